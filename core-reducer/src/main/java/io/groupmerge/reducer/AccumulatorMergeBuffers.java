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
import io.groupmerge.reducer.function.AggregateFunction;

import java.util.ArrayList;
import java.util.List;

import static io.groupmerge.reducer.exception.IndexContractViolationException.Role.ACCUMULATOR;

/**
 * Fixed two-slot merge buffers, one per aggregate function, allocated once and reused for every group.
 * <p>
 * Slot 0 holds the running accumulator, slot 1 the accumulator most recently read from a record.
 * Slot 1 is never reset, it is overwritten before each merge.
 */
@SuppressWarnings({"rawtypes", "unchecked"})
final class AccumulatorMergeBuffers {
	private final AggregateFunction[] functions;
	private final List<Object>[] buffers;

	AccumulatorMergeBuffers(List<AggregateFunction<?, ?>> functions) {
		this.functions = functions.toArray(new AggregateFunction[0]);
		this.buffers = new List[this.functions.length];
		for (int i = 0; i < this.functions.length; i++) {
			Object accumulator = this.functions[i].createAccumulator();
			List<Object> buffer = new ArrayList<>(2);
			buffer.add(accumulator);
			buffer.add(accumulator);
			buffers[i] = buffer;
		}
	}

	int size() {
		return functions.length;
	}

	void reset() {
		for (int i = 0; i < functions.length; i++) {
			buffers[i].set(0, functions[i].createAccumulator());
		}
	}

	/**
	 * Merges accumulators of a record, the one of function {@code i} being at field {@code offset + i}
	 */
	void merge(Record record, int offset) {
		for (int i = 0; i < functions.length; i++) {
			List<Object> buffer = buffers[i];
			buffer.set(1, FieldAccess.read(record, offset + i, ACCUMULATOR));
			buffer.set(0, functions[i].merge(buffer));
		}
	}

	Object getAccumulator(int i) {
		return buffers[i].get(0);
	}

	Object getValue(int i) {
		return functions[i].getValue(buffers[i].get(0));
	}
}
