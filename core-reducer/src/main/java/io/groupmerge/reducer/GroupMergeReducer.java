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

import io.groupmerge.common.Checks;
import io.groupmerge.common.builder.AbstractBuilder;
import io.groupmerge.common.record.Record;
import io.groupmerge.reducer.exception.ConfigurationException;
import io.groupmerge.reducer.exception.MalformedGroupException;
import io.groupmerge.reducer.function.AggregateFunction;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static io.groupmerge.reducer.exception.IndexContractViolationException.Role.GROUP_KEY;

/**
 * Merges grouped intermediate records into one final output record per group.
 * <p>
 * An intermediate record is laid out as {@code [group keys...][one accumulator per aggregate function]},
 * accumulators following the order of the aggregate function registry. For every group the reducer merges
 * accumulators of all records, then sets into its output record:
 * <ul>
 *     <li>group key values, as mapped by {@code groupKeysMapping} (intermediate index to output index)</li>
 *     <li>final aggregate values, as mapped by {@code aggregateMapping} (function index to output index)</li>
 *     <li>grouping set indicators, as mapped by {@code groupingSetsMapping} (key index to output index):
 *     {@code false} if the key is one of the group keys of this reducer, {@code true} if it was rolled up</li>
 * </ul>
 * <p>
 * The output record and the merge buffers are allocated once and reused for every group,
 * so a {@link RecordSink} must not retain the emitted record. An instance is not thread-safe:
 * parallel partitions should each use their own reducer.
 */
public final class GroupMergeReducer implements GroupReduceFunction {
	private static final Logger logger = LoggerFactory.getLogger(GroupMergeReducer.class);
	private static final boolean CHECKS = Checks.isEnabled(GroupMergeReducer.class);

	private final List<AggregateFunction<?, ?>> aggregates;
	private final IndexMapping[] groupKeysMapping;
	private final IndexMapping[] aggregateMapping;
	private final IndexMapping[] groupingSetsMapping;
	private final int finalRowArity;

	// active keys are fixed for the lifetime of a reducer, so are the indicators
	private final boolean[] groupingSetIndicators;

	private final Record output;
	private final AccumulatorMergeBuffers buffers;

	private long groupsReduced;
	private long recordsMerged;

	private GroupMergeReducer(List<AggregateFunction<?, ?>> aggregates, IndexMapping[] groupKeysMapping,
			IndexMapping[] aggregateMapping, IndexMapping[] groupingSetsMapping, int finalRowArity) {
		this.aggregates = aggregates;
		this.groupKeysMapping = groupKeysMapping;
		this.aggregateMapping = aggregateMapping;
		this.groupingSetsMapping = groupingSetsMapping;
		this.finalRowArity = finalRowArity;

		Set<Integer> intermediateGroupKeys = new HashSet<>();
		for (IndexMapping mapping : groupKeysMapping) {
			intermediateGroupKeys.add(mapping.source());
		}
		this.groupingSetIndicators = new boolean[groupingSetsMapping.length];
		for (int i = 0; i < groupingSetsMapping.length; i++) {
			groupingSetIndicators[i] = !intermediateGroupKeys.contains(groupingSetsMapping[i].source());
		}

		this.output = Record.create(finalRowArity);
		this.buffers = new AccumulatorMergeBuffers(aggregates);
	}

	public static GroupMergeReducer create(List<AggregateFunction<?, ?>> aggregates,
			List<IndexMapping> groupKeysMapping, List<IndexMapping> aggregateMapping,
			List<IndexMapping> groupingSetsMapping, int finalRowArity) {
		return builder(aggregates, groupKeysMapping, finalRowArity)
				.withAggregateMapping(aggregateMapping)
				.withGroupingSetsMapping(groupingSetsMapping)
				.build();
	}

	public static Builder builder(List<AggregateFunction<?, ?>> aggregates, List<IndexMapping> groupKeysMapping,
			int finalRowArity) {
		return new Builder(aggregates, groupKeysMapping, finalRowArity);
	}

	public static final class Builder extends AbstractBuilder<Builder, GroupMergeReducer> {
		private final @Nullable List<AggregateFunction<?, ?>> aggregates;
		private final @Nullable List<IndexMapping> groupKeysMapping;
		private final int finalRowArity;
		private @Nullable List<IndexMapping> aggregateMapping = List.of();
		private @Nullable List<IndexMapping> groupingSetsMapping = List.of();

		private Builder(@Nullable List<AggregateFunction<?, ?>> aggregates, @Nullable List<IndexMapping> groupKeysMapping,
				int finalRowArity) {
			this.aggregates = aggregates;
			this.groupKeysMapping = groupKeysMapping;
			this.finalRowArity = finalRowArity;
		}

		public Builder withAggregateMapping(List<IndexMapping> aggregateMapping) {
			checkNotBuilt(this);
			this.aggregateMapping = aggregateMapping;
			return this;
		}

		public Builder withAggregateMapping(IndexMapping... aggregateMapping) {
			return withAggregateMapping(Arrays.asList(aggregateMapping));
		}

		public Builder withGroupingSetsMapping(List<IndexMapping> groupingSetsMapping) {
			checkNotBuilt(this);
			this.groupingSetsMapping = groupingSetsMapping;
			return this;
		}

		public Builder withGroupingSetsMapping(IndexMapping... groupingSetsMapping) {
			return withGroupingSetsMapping(Arrays.asList(groupingSetsMapping));
		}

		@Override
		protected GroupMergeReducer doBuild() {
			List<AggregateFunction<?, ?>> registry = Mappings.checkRegistry(aggregates);
			IndexMapping[] groupKeys = Mappings.checkTable(groupKeysMapping, "group keys");
			IndexMapping[] aggregateValues = Mappings.checkTable(aggregateMapping, "aggregates");
			IndexMapping[] groupingSets = Mappings.checkTable(groupingSetsMapping, "grouping sets");
			if (finalRowArity < 0) {
				throw new ConfigurationException("Final row arity must not be negative, was " + finalRowArity);
			}

			Mappings.checkSources(groupKeys, "group keys", Integer.MAX_VALUE);
			Mappings.checkSources(aggregateValues, "aggregates", registry.size());
			Mappings.checkSources(groupingSets, "grouping sets", Integer.MAX_VALUE);

			BitSet claimed = new BitSet(finalRowArity);
			Mappings.checkTargets(groupKeys, "group keys", finalRowArity, claimed);
			Mappings.checkTargets(aggregateValues, "aggregates", finalRowArity, claimed);
			Mappings.checkTargets(groupingSets, "grouping sets", finalRowArity, claimed);

			GroupMergeReducer reducer = new GroupMergeReducer(registry, groupKeys, aggregateValues, groupingSets, finalRowArity);
			logger.debug("Created {}", reducer);
			return reducer;
		}
	}

	/**
	 * Merges all intermediate records of a group and emits exactly one output record.
	 * <p>
	 * Even a single-record group goes through a merge with a fresh accumulator.
	 *
	 * @throws MalformedGroupException if the group has no records, or, with checks enabled,
	 *                                 if its records disagree on group-key values
	 * @throws io.groupmerge.reducer.exception.IndexContractViolationException if a record lacks a mapped field
	 */
	@Override
	public void reduceGroup(Iterable<Record> records, RecordSink out) {
		buffers.reset();

		int accumulatorsOffset = groupKeysMapping.length;
		Record last = null;
		for (Record record : records) {
			if (CHECKS && last != null) {
				checkSameGroup(last, record);
			}
			buffers.merge(record, accumulatorsOffset);
			last = record;
			recordsMerged++;
		}
		if (last == null) {
			throw new MalformedGroupException("Group has no records");
		}

		for (IndexMapping mapping : groupKeysMapping) {
			output.set(mapping.target(), FieldAccess.read(last, mapping.source(), GROUP_KEY));
		}

		for (IndexMapping mapping : aggregateMapping) {
			output.set(mapping.target(), buffers.getValue(mapping.source()));
		}

		for (int i = 0; i < groupingSetsMapping.length; i++) {
			output.set(groupingSetsMapping[i].target(), groupingSetIndicators[i]);
		}

		groupsReduced++;
		if (logger.isTraceEnabled()) {
			logger.trace("Reduced group into {}", output);
		}
		out.accept(output);
	}

	private void checkSameGroup(Record previous, Record record) {
		for (IndexMapping mapping : groupKeysMapping) {
			Object expected = FieldAccess.read(previous, mapping.source(), GROUP_KEY);
			Object actual = FieldAccess.read(record, mapping.source(), GROUP_KEY);
			if (!Objects.equals(expected, actual)) {
				throw new MalformedGroupException("Records of a group disagree on group key at index " +
						mapping.source() + ": " + expected + " != " + actual);
			}
		}
	}

	public List<AggregateFunction<?, ?>> getAggregates() {
		return aggregates;
	}

	public int getFinalRowArity() {
		return finalRowArity;
	}

	// stats
	public long getGroupsReduced() {
		return groupsReduced;
	}

	public long getRecordsMerged() {
		return recordsMerged;
	}

	@Override
	public String toString() {
		return "GroupMergeReducer{" +
				"aggregates=" + aggregates +
				", groupKeysMapping=" + Arrays.toString(groupKeysMapping) +
				", aggregateMapping=" + Arrays.toString(aggregateMapping) +
				", groupingSetsMapping=" + Arrays.toString(groupingSetsMapping) +
				", finalRowArity=" + finalRowArity +
				'}';
	}
}
