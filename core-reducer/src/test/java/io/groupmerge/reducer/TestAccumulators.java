package io.groupmerge.reducer;

import io.groupmerge.reducer.function.AggregateFunction;

final class TestAccumulators {
	private TestAccumulators() {
	}

	static <A> A accumulatorOf(AggregateFunction<A, ?> function, Object... values) {
		A accumulator = function.createAccumulator();
		for (Object value : values) {
			function.accumulate(accumulator, value);
		}
		return accumulator;
	}
}
