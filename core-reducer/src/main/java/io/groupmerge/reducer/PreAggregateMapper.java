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

import io.groupmerge.common.builder.AbstractBuilder;
import io.groupmerge.common.record.Record;
import io.groupmerge.reducer.exception.ConfigurationException;
import io.groupmerge.reducer.function.AggregateFunction;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

import static io.groupmerge.reducer.exception.IndexContractViolationException.Role.INPUT;

/**
 * Turns raw input records into intermediate records: the group-key fields followed by
 * one single-value accumulator per aggregate function.
 * <p>
 * Each aggregate function reads its argument from one input field. An argument index of
 * {@link #NO_ARGUMENT} makes the function accumulate a non-null marker instead,
 * which is how {@code COUNT(*)} counts rows.
 */
@SuppressWarnings({"rawtypes", "unchecked"})
public final class PreAggregateMapper {
	private static final Logger logger = LoggerFactory.getLogger(PreAggregateMapper.class);

	public static final int NO_ARGUMENT = -1;

	private final AggregateFunction[] aggregates;
	private final int[] groupKeyIndexes;
	private final int[] argumentIndexes;
	private final Record output;

	private PreAggregateMapper(List<AggregateFunction<?, ?>> aggregates, int[] groupKeyIndexes, int[] argumentIndexes) {
		this.aggregates = aggregates.toArray(new AggregateFunction[0]);
		this.groupKeyIndexes = groupKeyIndexes;
		this.argumentIndexes = argumentIndexes;
		this.output = Record.create(groupKeyIndexes.length + aggregates.size());
	}

	public static Builder builder(List<AggregateFunction<?, ?>> aggregates, int... groupKeyIndexes) {
		return new Builder(aggregates, groupKeyIndexes);
	}

	public static final class Builder extends AbstractBuilder<Builder, PreAggregateMapper> {
		private final @Nullable List<AggregateFunction<?, ?>> aggregates;
		private final int[] groupKeyIndexes;
		private int[] argumentIndexes;

		private Builder(@Nullable List<AggregateFunction<?, ?>> aggregates, int[] groupKeyIndexes) {
			this.aggregates = aggregates;
			this.groupKeyIndexes = groupKeyIndexes.clone();
		}

		/**
		 * Sets the input field read by each aggregate function, in registry order
		 */
		public Builder withArgumentIndexes(int... argumentIndexes) {
			checkNotBuilt(this);
			this.argumentIndexes = argumentIndexes.clone();
			return this;
		}

		@Override
		protected PreAggregateMapper doBuild() {
			List<AggregateFunction<?, ?>> registry = Mappings.checkRegistry(aggregates);
			if (argumentIndexes == null) {
				throw new ConfigurationException("Argument indexes are missing");
			}
			if (argumentIndexes.length != registry.size()) {
				throw new ConfigurationException("Expected " + registry.size() + " argument indexes, got " +
						argumentIndexes.length);
			}
			for (int index : groupKeyIndexes) {
				if (index < 0) {
					throw new ConfigurationException("Group key index must not be negative, was " + index);
				}
			}
			for (int index : argumentIndexes) {
				if (index < NO_ARGUMENT) {
					throw new ConfigurationException("Invalid argument index " + index);
				}
			}
			PreAggregateMapper mapper = new PreAggregateMapper(registry, groupKeyIndexes, argumentIndexes);
			logger.debug("Created {}", mapper);
			return mapper;
		}
	}

	/**
	 * Maps an input record to an intermediate record. The emitted record is reused,
	 * the accumulators inside it are fresh for every call.
	 *
	 * @throws io.groupmerge.reducer.exception.IndexContractViolationException if the input lacks a configured field
	 */
	public void map(Record input, RecordSink out) {
		for (int i = 0; i < groupKeyIndexes.length; i++) {
			output.set(i, FieldAccess.read(input, groupKeyIndexes[i], INPUT));
		}
		for (int i = 0; i < aggregates.length; i++) {
			Object accumulator = aggregates[i].createAccumulator();
			int argumentIndex = argumentIndexes[i];
			Object value = argumentIndex == NO_ARGUMENT ? Boolean.TRUE : FieldAccess.read(input, argumentIndex, INPUT);
			aggregates[i].accumulate(accumulator, value);
			output.set(groupKeyIndexes.length + i, accumulator);
		}
		out.accept(output);
	}

	public int getGroupKeyCount() {
		return groupKeyIndexes.length;
	}

	@Override
	public String toString() {
		return "PreAggregateMapper{" +
				"aggregates=" + Arrays.toString(aggregates) +
				", groupKeyIndexes=" + Arrays.toString(groupKeyIndexes) +
				", argumentIndexes=" + Arrays.toString(argumentIndexes) +
				'}';
	}
}
