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
import io.groupmerge.reducer.exception.IndexContractViolationException;
import io.groupmerge.reducer.exception.IndexContractViolationException.Role;
import org.jetbrains.annotations.Nullable;

final class FieldAccess {
	private FieldAccess() {
	}

	static @Nullable Object read(Record record, int index, Role role) {
		if (index >= record.getArity()) {
			throw new IndexContractViolationException(role, index, record.getArity());
		}
		return record.get(index);
	}
}
