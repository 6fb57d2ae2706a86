package io.groupmerge.reducer;

import io.groupmerge.common.record.Record;
import io.groupmerge.reducer.exception.ConfigurationException;
import io.groupmerge.reducer.exception.IndexContractViolationException;
import io.groupmerge.reducer.function.AggregateFunction;
import io.groupmerge.reducer.function.impl.Count;
import io.groupmerge.reducer.function.impl.LongSum;
import org.junit.Test;

import java.util.List;

import static io.groupmerge.reducer.PreAggregateMapper.NO_ARGUMENT;
import static io.groupmerge.reducer.function.AggregateFunctions.count;
import static io.groupmerge.reducer.function.AggregateFunctions.longSum;
import static org.junit.Assert.*;

public class PreAggregateMapperTest {
	private final AggregateFunction<LongSum.Accumulator, Long> sum = longSum();
	private final AggregateFunction<Count.Accumulator, Long> count = count();

	@Test
	public void testMapsToIntermediateRecord() {
		// input: [region, amount, comment]
		PreAggregateMapper mapper = PreAggregateMapper.builder(List.of(sum, count, count), 0)
				.withArgumentIndexes(1, 2, NO_ARGUMENT)
				.build();
		ToListRecordSink sink = ToListRecordSink.create();

		mapper.map(Record.of("eu", 12, null), sink);

		Record intermediate = sink.getList().get(0);
		assertEquals(4, intermediate.getArity());
		assertEquals("eu", intermediate.get(0));
		assertEquals(12L, (long) sum.getValue(intermediate.get(1)));
		assertEquals(0L, (long) count.getValue(intermediate.get(2)));
		assertEquals(1L, (long) count.getValue(intermediate.get(3)));
		assertEquals(1, mapper.getGroupKeyCount());
	}

	@Test
	public void testAccumulatorsAreFreshPerRecord() {
		PreAggregateMapper mapper = PreAggregateMapper.builder(List.of(sum), 0)
				.withArgumentIndexes(1)
				.build();
		ToListRecordSink sink = ToListRecordSink.create();

		mapper.map(Record.of("a", 1), sink);
		mapper.map(Record.of("a", 2), sink);

		assertNotSame(sink.getList().get(0).get(1), sink.getList().get(1).get(1));
		assertEquals(1L, (long) sum.getValue(sink.getList().get(0).get(1)));
	}

	@Test
	public void testMissingInputField() {
		PreAggregateMapper mapper = PreAggregateMapper.builder(List.of(sum), 0)
				.withArgumentIndexes(3)
				.build();

		IndexContractViolationException e = assertThrows(IndexContractViolationException.class,
				() -> mapper.map(Record.of("a", 1), record -> {}));
		assertEquals(IndexContractViolationException.Role.INPUT, e.getRole());
		assertEquals(3, e.getIndex());
	}

	@Test
	public void testConfigurationErrors() {
		assertThrows(ConfigurationException.class,
				() -> PreAggregateMapper.builder(List.of(sum), 0).build());
		assertThrows(ConfigurationException.class,
				() -> PreAggregateMapper.builder(List.of(sum, count), 0).withArgumentIndexes(1).build());
		assertThrows(ConfigurationException.class,
				() -> PreAggregateMapper.builder(List.of(sum), -1).withArgumentIndexes(1).build());
		assertThrows(ConfigurationException.class,
				() -> PreAggregateMapper.builder(List.of(sum), 0).withArgumentIndexes(-2).build());
	}
}
