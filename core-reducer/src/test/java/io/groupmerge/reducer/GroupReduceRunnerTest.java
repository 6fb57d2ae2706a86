package io.groupmerge.reducer;

import io.groupmerge.common.record.Record;
import io.groupmerge.reducer.exception.ConfigurationException;
import io.groupmerge.reducer.function.AggregateFunction;
import org.junit.Test;

import java.util.Collections;
import java.util.List;

import static io.groupmerge.reducer.IndexMapping.of;
import static io.groupmerge.reducer.PreAggregateMapper.NO_ARGUMENT;
import static io.groupmerge.reducer.function.AggregateFunctions.*;
import static org.junit.Assert.*;

public class GroupReduceRunnerTest {
	private static final List<AggregateFunction<?, ?>> REGISTRY = List.of(longSum(), count(), avg());

	@Test
	public void testEmptyInput() {
		GroupMergeReducer reducer = GroupMergeReducer.create(REGISTRY, List.of(of(0, 0)), List.of(of(0, 1)), List.of(), 2);
		ToListRecordSink sink = ToListRecordSink.create();

		long groups = GroupReduceRunner.create(reducer, 0).run(Collections.<Record>emptyList(), sink);

		assertEquals(0, groups);
		assertTrue(sink.getList().isEmpty());
	}

	@Test
	public void testGroupsAreContiguousRuns() {
		GroupCombiner combiner = GroupCombiner.create(List.of(longSum()), 1);
		ToListRecordSink sink = ToListRecordSink.create();

		long groups = GroupReduceRunner.create(combiner, 0).run(List.of(
				Record.of("a", TestAccumulators.accumulatorOf(longSum(), 1)),
				Record.of("a", TestAccumulators.accumulatorOf(longSum(), 1)),
				Record.of("b", TestAccumulators.accumulatorOf(longSum(), 1)),
				Record.of("a", TestAccumulators.accumulatorOf(longSum(), 1))), sink);

		assertEquals(3, groups);
		assertEquals(3, sink.getList().size());
		assertEquals("a", sink.getList().get(0).get(0));
		assertEquals("b", sink.getList().get(1).get(0));
		assertEquals("a", sink.getList().get(2).get(0));
	}

	@Test
	public void testPartialThenFinalAggregation() {
		// raw rows: [region, year, amount], already sorted by key
		List<Record> rows = List.of(
				Record.of("eu", 2023, 10),
				Record.of("eu", 2023, 20),
				Record.of("eu", 2024, null),
				Record.of("us", 2023, 5));

		PreAggregateMapper mapper = PreAggregateMapper.builder(REGISTRY, 0, 1)
				.withArgumentIndexes(2, NO_ARGUMENT, 2)
				.build();
		ToListRecordSink intermediate = ToListRecordSink.create();
		for (Record row : rows) {
			mapper.map(row, intermediate);
		}

		GroupCombiner combiner = GroupCombiner.create(REGISTRY, 2);
		ToListRecordSink combined = ToListRecordSink.create();
		assertEquals(3, GroupReduceRunner.create(combiner, 0, 1).run(intermediate.getList(), combined));

		// final output: [region, year, sum, count, avg]
		GroupMergeReducer reducer = GroupMergeReducer.builder(REGISTRY, List.of(of(0, 0), of(1, 1)), 5)
				.withAggregateMapping(of(0, 2), of(1, 3), of(2, 4))
				.build();
		ToListRecordSink result = ToListRecordSink.create();
		assertEquals(3, GroupReduceRunner.create(reducer, 0, 1).run(combined.getList().iterator(), result));

		assertEquals(List.of(
				Record.of("eu", 2023, 30L, 2L, 15.0),
				Record.of("eu", 2024, null, 1L, null),
				Record.of("us", 2023, 5L, 1L, 5.0)), result.getList());
	}

	@Test
	public void testRollupOfOneKey() {
		// intermediate rows grouped by region only; year is rolled up
		GroupMergeReducer reducer = GroupMergeReducer.builder(List.of(longSum()), List.of(of(0, 0)), 4)
				.withAggregateMapping(of(0, 2))
				.withGroupingSetsMapping(of(0, 3), of(1, 1))
				.build();
		ToListRecordSink sink = ToListRecordSink.create();

		GroupReduceRunner.create(reducer, 0).run(List.of(
				Record.of("eu", TestAccumulators.accumulatorOf(longSum(), 10, 20)),
				Record.of("us", TestAccumulators.accumulatorOf(longSum(), 5))), sink);

		assertEquals(List.of(
				Record.of("eu", true, 30L, false),
				Record.of("us", true, 5L, false)), sink.getList());
	}

	@Test
	public void testNegativeKeyIndex() {
		GroupCombiner combiner = GroupCombiner.create(List.of(longSum()), 1);
		assertThrows(ConfigurationException.class, () -> GroupReduceRunner.create(combiner, -1));
	}
}
