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

package io.groupmerge.common.record;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

import static io.groupmerge.common.Checks.checkArgument;

/**
 * A fixed-arity row whose fields are addressed by integer index only.
 * <p>
 * Records are mutable and not thread-safe. A record handed out by a stage that reuses
 * its output instance must be {@link #copy() copied} if it has to outlive the next emission.
 */
public final class Record {
	private final Object[] fields;

	private Record(Object[] fields) {
		this.fields = fields;
	}

	public static Record create(int arity) {
		checkArgument(arity >= 0, "Arity must not be negative, was %s", arity);
		return new Record(new Object[arity]);
	}

	public static Record of(Object... values) {
		return new Record(values.clone());
	}

	public int getArity() {
		return fields.length;
	}

	@SuppressWarnings("unchecked")
	public <T> @Nullable T get(int index) {
		return (T) fields[checkIndex(index)];
	}

	public void set(int index, @Nullable Object value) {
		fields[checkIndex(index)] = value;
	}

	public void clear() {
		Arrays.fill(fields, null);
	}

	/**
	 * Returns a shallow copy: field values are shared, the field array is not
	 */
	public Record copy() {
		return new Record(fields.clone());
	}

	public Object[] toArray() {
		return fields.clone();
	}

	public void setArray(Object[] values) {
		checkArgument(values.length == fields.length,
				"Expected %s values, got %s", fields.length, values.length);
		System.arraycopy(values, 0, fields, 0, fields.length);
	}

	private int checkIndex(int index) {
		if (index < 0 || index >= fields.length) {
			throw new IndexOutOfBoundsException("Field index " + index + " is out of bounds for arity " + fields.length);
		}
		return index;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Record record = (Record) o;
		return Arrays.equals(fields, record.fields);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(fields);
	}

	@Override
	public String toString() {
		return Arrays.toString(fields);
	}
}
