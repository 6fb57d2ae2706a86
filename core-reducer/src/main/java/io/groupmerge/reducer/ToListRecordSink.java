/*
 * Copyright (C) 2020 ActiveJ LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.groupmerge.reducer;

import io.groupmerge.common.record.Record;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects copies of received records
 */
public final class ToListRecordSink implements RecordSink {
	private final List<Record> list;

	private ToListRecordSink(List<Record> list) {
		this.list = list;
	}

	public static ToListRecordSink create() {
		return new ToListRecordSink(new ArrayList<>());
	}

	public static ToListRecordSink create(List<Record> list) {
		return new ToListRecordSink(list);
	}

	@Override
	public void accept(Record record) {
		list.add(record.copy());
	}

	public List<Record> getList() {
		return list;
	}
}
