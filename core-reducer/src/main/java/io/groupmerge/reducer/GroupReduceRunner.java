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

import io.groupmerge.common.ApplicationSettings;
import io.groupmerge.common.record.Record;
import io.groupmerge.reducer.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import static io.groupmerge.common.Checks.checkNotNull;
import static io.groupmerge.reducer.exception.IndexContractViolationException.Role.GROUP_KEY;

/**
 * Cuts a stream of records into groups and feeds each of them to a {@link GroupReduceFunction}.
 * <p>
 * Records must arrive ordered (or at least clustered) by key: a group is a maximal run of
 * consecutive records with equal values at the key indexes. Records are buffered per group,
 * so the source must not reuse record instances.
 */
public final class GroupReduceRunner {
	private static final Logger logger = LoggerFactory.getLogger(GroupReduceRunner.class);
	private static final int LOG_EVERY = ApplicationSettings.getInt(GroupReduceRunner.class, "logEvery", 0);

	private final GroupReduceFunction function;
	private final int[] keyIndexes;

	private GroupReduceRunner(GroupReduceFunction function, int[] keyIndexes) {
		this.function = function;
		this.keyIndexes = keyIndexes;
	}

	public static GroupReduceRunner create(GroupReduceFunction function, int... keyIndexes) {
		checkNotNull(function, "Group reduce function is missing");
		for (int index : keyIndexes) {
			if (index < 0) {
				throw new ConfigurationException("Key index must not be negative, was " + index);
			}
		}
		return new GroupReduceRunner(function, keyIndexes.clone());
	}

	/**
	 * Processes all records
	 *
	 * @return number of groups passed to the function
	 */
	public long run(Iterator<Record> records, RecordSink out) {
		List<Record> group = new ArrayList<>();
		Object[] groupKey = null;
		long groups = 0;
		long count = 0;
		while (records.hasNext()) {
			Record record = records.next();
			Object[] key = keyOf(record);
			if (groupKey != null && !Arrays.equals(groupKey, key)) {
				reduce(group, out, ++groups);
				group.clear();
			}
			groupKey = key;
			group.add(record);
			count++;
		}
		if (!group.isEmpty()) {
			reduce(group, out, ++groups);
		}
		logger.debug("Reduced {} records into {} groups with {}", count, groups, function);
		return groups;
	}

	public long run(Iterable<Record> records, RecordSink out) {
		return run(records.iterator(), out);
	}

	private void reduce(List<Record> group, RecordSink out, long groupNumber) {
		function.reduceGroup(group, out);
		if (LOG_EVERY > 0 && groupNumber % LOG_EVERY == 0) {
			logger.debug("Reduced {} groups so far", groupNumber);
		}
	}

	private Object[] keyOf(Record record) {
		Object[] key = new Object[keyIndexes.length];
		for (int i = 0; i < keyIndexes.length; i++) {
			key[i] = FieldAccess.read(record, keyIndexes[i], GROUP_KEY);
		}
		return key;
	}

	@Override
	public String toString() {
		return "GroupReduceRunner{" +
				"function=" + function +
				", keyIndexes=" + Arrays.toString(keyIndexes) +
				'}';
	}
}
