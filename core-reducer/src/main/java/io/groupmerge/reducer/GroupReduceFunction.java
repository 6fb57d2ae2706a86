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

/**
 * Reduces all records of one group into output records
 */
public interface GroupReduceFunction {
	/**
	 * Consumes a group of records and emits the result
	 *
	 * @param records records of one group, all sharing identical group-key values,
	 *                iterated exactly once
	 * @param out     sink for the result
	 */
	void reduceGroup(Iterable<Record> records, RecordSink out);
}
