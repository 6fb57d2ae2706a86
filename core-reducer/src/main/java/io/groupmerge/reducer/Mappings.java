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

import io.groupmerge.reducer.exception.ConfigurationException;
import io.groupmerge.reducer.function.AggregateFunction;
import org.jetbrains.annotations.Nullable;

import java.util.BitSet;
import java.util.List;

final class Mappings {
	private Mappings() {
	}

	static List<AggregateFunction<?, ?>> checkRegistry(@Nullable List<AggregateFunction<?, ?>> aggregates) {
		if (aggregates == null) {
			throw new ConfigurationException("Aggregate function registry is missing");
		}
		if (aggregates.isEmpty()) {
			throw new ConfigurationException("Aggregate function registry is empty");
		}
		for (int i = 0; i < aggregates.size(); i++) {
			if (aggregates.get(i) == null) {
				throw new ConfigurationException("Aggregate function #" + i + " is missing");
			}
		}
		return List.copyOf(aggregates);
	}

	static IndexMapping[] checkTable(@Nullable List<IndexMapping> table, String name) {
		if (table == null) {
			throw new ConfigurationException("Mapping of " + name + " is missing");
		}
		IndexMapping[] result = table.toArray(new IndexMapping[0]);
		for (int i = 0; i < result.length; i++) {
			if (result[i] == null) {
				throw new ConfigurationException("Mapping of " + name + " has a missing entry #" + i);
			}
		}
		return result;
	}

	/**
	 * Checks that every source is in {@code [0, bound)}
	 */
	static void checkSources(IndexMapping[] table, String name, int bound) {
		for (IndexMapping mapping : table) {
			if (mapping.source() < 0 || mapping.source() >= bound) {
				throw new ConfigurationException("Mapping of " + name + " has source index " + mapping.source() +
						(bound == Integer.MAX_VALUE ? " which is negative" : " outside of [0, " + bound + ")"));
			}
		}
	}

	/**
	 * Checks that every target is in {@code [0, arity)} and that no target is claimed twice across tables
	 */
	static void checkTargets(IndexMapping[] table, String name, int arity, BitSet claimed) {
		for (IndexMapping mapping : table) {
			int target = mapping.target();
			if (target < 0 || target >= arity) {
				throw new ConfigurationException("Mapping of " + name + " has output index " + target +
						" outside of [0, " + arity + ")");
			}
			if (claimed.get(target)) {
				throw new ConfigurationException("Output index " + target + " is mapped more than once");
			}
			claimed.set(target);
		}
	}
}
