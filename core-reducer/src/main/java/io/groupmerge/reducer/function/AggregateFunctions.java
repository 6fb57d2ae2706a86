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

package io.groupmerge.reducer.function;

import io.groupmerge.common.annotation.StaticFactories;
import io.groupmerge.reducer.function.impl.*;

/**
 * Static utility methods pertaining to {@link AggregateFunction}.
 * Contains primary ready for use aggregate functions.
 * <p>
 * All of them ignore {@code null} input values.
 */
@StaticFactories(AggregateFunction.class)
public class AggregateFunctions {

	/**
	 * Returns function which sums integral values as {@code long}, or {@code null} if no value was seen
	 */
	public static AggregateFunction<LongSum.Accumulator, Long> longSum() {
		return new LongSum();
	}

	/**
	 * Returns function which sums numeric values as {@code double}, or {@code null} if no value was seen
	 */
	public static AggregateFunction<DoubleSum.Accumulator, Double> doubleSum() {
		return new DoubleSum();
	}

	/**
	 * Returns function which counts non-null values
	 */
	public static AggregateFunction<Count.Accumulator, Long> count() {
		return new Count();
	}

	/**
	 * Returns function which computes arithmetic mean of numeric values, or {@code null} if no value was seen
	 */
	public static AggregateFunction<Avg.Accumulator, Double> avg() {
		return new Avg();
	}

	/**
	 * Returns function which finds the least value
	 *
	 * @param <T> type of values
	 */
	public static <T extends Comparable<? super T>> AggregateFunction<Extremum.Accumulator<T>, T> min() {
		return Extremum.min();
	}

	/**
	 * Returns function which finds the greatest value
	 *
	 * @param <T> type of values
	 */
	public static <T extends Comparable<? super T>> AggregateFunction<Extremum.Accumulator<T>, T> max() {
		return Extremum.max();
	}
}
