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

package io.groupmerge.reducer.function.impl;

import io.groupmerge.reducer.function.AggregateFunction;
import org.jetbrains.annotations.Nullable;

import java.util.List;

public final class LongSum implements AggregateFunction<LongSum.Accumulator, Long> {
	public static final class Accumulator {
		long sum;
		boolean seen;

		@Override
		public String toString() {
			return seen ? "LongSum{" + sum + '}' : "LongSum{}";
		}
	}

	@Override
	public Accumulator createAccumulator() {
		return new Accumulator();
	}

	@Override
	public void accumulate(Accumulator accumulator, @Nullable Object value) {
		if (value == null) return;
		accumulator.sum += ((Number) value).longValue();
		accumulator.seen = true;
	}

	@Override
	public Accumulator merge(List<Accumulator> accumulators) {
		Accumulator result = accumulators.get(0);
		for (int i = 1; i < accumulators.size(); i++) {
			Accumulator other = accumulators.get(i);
			result.sum += other.sum;
			result.seen |= other.seen;
		}
		return result;
	}

	@Override
	public @Nullable Long getValue(Accumulator accumulator) {
		return accumulator.seen ? accumulator.sum : null;
	}

	@Override
	public String toString() {
		return "SUM";
	}
}
