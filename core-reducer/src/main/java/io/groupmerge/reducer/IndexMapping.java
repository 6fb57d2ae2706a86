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

/**
 * A single entry of an index mapping table: a value is read at {@code source}
 * and written to field {@code target} of the output record.
 * <p>
 * What {@code source} addresses depends on the table: an intermediate record field
 * for group keys, a position in the aggregate function registry for aggregates,
 * a key index for grouping set indicators.
 */
public record IndexMapping(int source, int target) {
	public static IndexMapping of(int source, int target) {
		return new IndexMapping(source, target);
	}

	@Override
	public String toString() {
		return source + "->" + target;
	}
}
