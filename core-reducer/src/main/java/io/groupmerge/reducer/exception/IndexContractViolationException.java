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

package io.groupmerge.reducer.exception;

/**
 * A mapping refers to a field that the actual record does not have.
 * <p>
 * Indicates a mismatch between planning-time configuration and the shape
 * of records seen at runtime.
 */
public final class IndexContractViolationException extends GroupMergeException {
	public enum Role {
		INPUT,
		GROUP_KEY,
		ACCUMULATOR
	}

	private final Role role;
	private final int index;
	private final int arity;

	public IndexContractViolationException(Role role, int index, int arity) {
		super(role + " field index " + index + " is out of bounds for record of arity " + arity);
		this.role = role;
		this.index = index;
		this.arity = arity;
	}

	public Role getRole() {
		return role;
	}

	public int getIndex() {
		return index;
	}

	public int getArity() {
		return arity;
	}
}
