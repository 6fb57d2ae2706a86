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

/**
 * MIN and MAX over {@link Comparable} values
 *
 * @param <T> type of values
 */
public final class Extremum<T extends Comparable<? super T>> implements AggregateFunction<Extremum.Accumulator<T>, T> {
	private final boolean max;

	private Extremum(boolean max) {
		this.max = max;
	}

	public static <T extends Comparable<? super T>> Extremum<T> min() {
		return new Extremum<>(false);
	}

	public static <T extends Comparable<? super T>> Extremum<T> max() {
		return new Extremum<>(true);
	}

	public static final class Accumulator<T> {
		@Nullable T value;

		@Override
		public String toString() {
			return "Extremum{" + value + '}';
		}
	}

	@Override
	public Accumulator<T> createAccumulator() {
		return new Accumulator<>();
	}

	@SuppressWarnings("unchecked")
	@Override
	public void accumulate(Accumulator<T> accumulator, @Nullable Object value) {
		if (value == null) return;
		offer(accumulator, (T) value);
	}

	@Override
	public Accumulator<T> merge(List<Accumulator<T>> accumulators) {
		Accumulator<T> result = accumulators.get(0);
		for (int i = 1; i < accumulators.size(); i++) {
			T value = accumulators.get(i).value;
			if (value != null) {
				offer(result, value);
			}
		}
		return result;
	}

	private void offer(Accumulator<T> accumulator, T value) {
		T current = accumulator.value;
		if (current == null) {
			accumulator.value = value;
			return;
		}
		int compare = value.compareTo(current);
		if (max ? compare > 0 : compare < 0) {
			accumulator.value = value;
		}
	}

	@Override
	public @Nullable T getValue(Accumulator<T> accumulator) {
		return accumulator.value;
	}

	@Override
	public String toString() {
		return max ? "MAX" : "MIN";
	}
}
