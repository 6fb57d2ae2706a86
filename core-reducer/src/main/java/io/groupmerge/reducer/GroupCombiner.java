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
import io.groupmerge.reducer.exception.ConfigurationException;
import io.groupmerge.reducer.exception.MalformedGroupException;
import io.groupmerge.reducer.function.AggregateFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static io.groupmerge.reducer.exception.IndexContractViolationException.Role.GROUP_KEY;

/**
 * Combines a group of intermediate records into a single intermediate record of the same layout,
 * {@code [group keys...][one accumulator per aggregate function]}, without extracting final values.
 * <p>
 * Emitted accumulators are owned by the receiver: a fresh running accumulator is created for every group.
 * The emitted record itself is reused, as with {@link GroupMergeReducer}.
 */
public final class GroupCombiner implements GroupReduceFunction {
	private static final Logger logger = LoggerFactory.getLogger(GroupCombiner.class);

	private final int groupKeyCount;
	private final Record output;
	private final AccumulatorMergeBuffers buffers;

	private long groupsCombined;

	private GroupCombiner(List<AggregateFunction<?, ?>> aggregates, int groupKeyCount) {
		this.groupKeyCount = groupKeyCount;
		this.output = Record.create(groupKeyCount + aggregates.size());
		this.buffers = new AccumulatorMergeBuffers(aggregates);
	}

	/**
	 * @param aggregates    aggregate function registry, in the order of accumulators in a record
	 * @param groupKeyCount number of leading group-key fields in intermediate records
	 */
	public static GroupCombiner create(List<AggregateFunction<?, ?>> aggregates, int groupKeyCount) {
		List<AggregateFunction<?, ?>> registry = Mappings.checkRegistry(aggregates);
		if (groupKeyCount < 0) {
			throw new ConfigurationException("Group key count must not be negative, was " + groupKeyCount);
		}
		GroupCombiner combiner = new GroupCombiner(registry, groupKeyCount);
		logger.debug("Created {} for {}", combiner, registry);
		return combiner;
	}

	@Override
	public void reduceGroup(Iterable<Record> records, RecordSink out) {
		buffers.reset();

		Record last = null;
		for (Record record : records) {
			buffers.merge(record, groupKeyCount);
			last = record;
		}
		if (last == null) {
			throw new MalformedGroupException("Group has no records");
		}

		for (int i = 0; i < groupKeyCount; i++) {
			output.set(i, FieldAccess.read(last, i, GROUP_KEY));
		}
		for (int i = 0; i < buffers.size(); i++) {
			output.set(groupKeyCount + i, buffers.getAccumulator(i));
		}

		groupsCombined++;
		out.accept(output);
	}

	public int getGroupKeyCount() {
		return groupKeyCount;
	}

	public long getGroupsCombined() {
		return groupsCombined;
	}

	@Override
	public String toString() {
		return "GroupCombiner{" +
				"groupKeyCount=" + groupKeyCount +
				", accumulators=" + buffers.size() +
				'}';
	}
}
