package io.groupmerge.reducer.function;

import io.groupmerge.reducer.function.impl.*;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static io.groupmerge.reducer.function.AggregateFunctions.*;
import static org.junit.Assert.*;

public class AggregateFunctionsTest {

	@Test
	public void testLongSum() {
		AggregateFunction<LongSum.Accumulator, Long> sum = longSum();

		assertNull(sum.getValue(sum.createAccumulator()));
		assertNull(sum.getValue(accumulate(sum, (Object) null)));
		assertEquals(6L, (long) sum.getValue(accumulate(sum, 1, 2L, null, 3)));
		assertEquals(10L, (long) sum.getValue(merge(sum, accumulate(sum, 3), accumulate(sum, 7))));
		assertEquals(0L, (long) sum.getValue(merge(sum, accumulate(sum, 0), sum.createAccumulator())));
	}

	@Test
	public void testDoubleSum() {
		AggregateFunction<DoubleSum.Accumulator, Double> sum = doubleSum();

		assertNull(sum.getValue(sum.createAccumulator()));
		assertEquals(4.0, sum.getValue(merge(sum, accumulate(sum, 1.5), accumulate(sum, 2.5f))), 1e-10);
	}

	@Test
	public void testCount() {
		AggregateFunction<Count.Accumulator, Long> count = count();

		assertEquals(0L, (long) count.getValue(count.createAccumulator()));
		assertEquals(2L, (long) count.getValue(accumulate(count, "a", null, "b")));
		assertEquals(5L, (long) count.getValue(merge(count, accumulate(count, 1, 2), accumulate(count, 1, 2, 3))));
	}

	@Test
	public void testAvg() {
		AggregateFunction<Avg.Accumulator, Double> avg = avg();

		assertNull(avg.getValue(avg.createAccumulator()));
		assertEquals(2.5, avg.getValue(merge(avg, accumulate(avg, 1, 2), accumulate(avg, 3, 4, null))), 1e-10);
	}

	@Test
	public void testMinAndMax() {
		AggregateFunction<Extremum.Accumulator<String>, String> min = min();
		AggregateFunction<Extremum.Accumulator<String>, String> max = max();

		assertNull(min.getValue(min.createAccumulator()));
		assertEquals("apple", min.getValue(merge(min, accumulate(min, "pear", null), accumulate(min, "apple", "plum"))));
		assertEquals("plum", max.getValue(merge(max, accumulate(max, "pear", null), accumulate(max, "apple", "plum"))));
		assertEquals("pear", max.getValue(merge(max, accumulate(max, "pear"), max.createAccumulator())));
	}

	@Test
	public void testMergeMutatesOnlyRunningAccumulator() {
		AggregateFunction<LongSum.Accumulator, Long> sum = longSum();
		LongSum.Accumulator running = accumulate(sum, 1);
		LongSum.Accumulator incoming = accumulate(sum, 2);

		LongSum.Accumulator result = sum.merge(new ArrayList<>(Arrays.asList(running, incoming)));

		assertSame(running, result);
		assertEquals(3L, (long) sum.getValue(result));
		assertEquals(2L, (long) sum.getValue(incoming));
	}

	@Test
	public void testMergeOutputCanBeResubmitted() {
		AggregateFunction<Count.Accumulator, Long> count = count();
		Count.Accumulator accumulator = count.createAccumulator();
		for (int i = 0; i < 3; i++) {
			accumulator = merge(count, accumulator, accumulate(count, "x"));
		}
		assertEquals(3L, (long) count.getValue(accumulator));
	}

	private static <A> A accumulate(AggregateFunction<A, ?> function, Object... values) {
		A accumulator = function.createAccumulator();
		for (Object value : values) {
			function.accumulate(accumulator, value);
		}
		return accumulator;
	}

	private static <A> A merge(AggregateFunction<A, ?> function, A running, A incoming) {
		List<A> buffer = new ArrayList<>(2);
		buffer.add(running);
		buffer.add(incoming);
		return function.merge(buffer);
	}
}
