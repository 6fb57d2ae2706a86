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

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * It is primary interface of an aggregate function.
 * <p>
 * An accumulator is an opaque state owned and interpreted only by the function that created it.
 * Accumulators returned by {@link #createAccumulator()} and {@link #merge(List)} may be
 * submitted to {@link #merge(List)} again any number of times.
 *
 * @param <A> type of accumulator
 * @param <T> type of final value
 */
public interface AggregateFunction<A, T> {
	/**
	 * Creates a new accumulator which represents an aggregation over no values
	 *
	 * @return new empty accumulator
	 */
	A createAccumulator();

	/**
	 * Folds a single raw input value into the accumulator
	 *
	 * @param accumulator accumulator which contains results of all previous operations
	 * @param value       received value, {@code null} for SQL NULL
	 */
	void accumulate(A accumulator, @Nullable Object value);

	/**
	 * Combines the accumulators of a merge buffer into one.
	 * <p>
	 * The reducer passes a two-slot buffer: slot 0 holds the running accumulator,
	 * slot 1 holds the incoming one. An implementation may mutate and return slot 0,
	 * but must not modify slot 1 and must not keep any reference to the list or its
	 * elements once the call returns, since slots are overwritten right after.
	 * <p>
	 * The combination should be associative and commutative. Functions that are not
	 * must document their order dependence themselves.
	 *
	 * @param accumulators accumulators to be combined
	 * @return combined accumulator
	 */
	A merge(List<A> accumulators);

	/**
	 * Extracts the final value from an accumulator
	 *
	 * @param accumulator accumulator obtained after all merges
	 * @return final value, {@code null} if the function is undefined over the seen values
	 */
	@Nullable T getValue(A accumulator);
}
