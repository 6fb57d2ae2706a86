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

package io.groupmerge.common;

import org.jetbrains.annotations.Nullable;

/**
 * Precondition helpers and runtime switches for optional checks.
 * <p>
 * Optional checks are meant for invariants that are too costly to verify in a tight loop
 * by default. The common pattern is having a
 * <pre>
 * {@code private static final boolean CHECKS = Checks.isEnabled(MyClass.class);}
 * </pre>
 * constant in a class and wrapping the verification like so:
 * <pre>
 * {@code if (CHECKS) checkState(...);}
 * </pre>
 * <p>
 * By default, all optional checks are <b>disabled</b> (like java asserts).
 * To enable all of them run the application with system property {@code -Dchk=on}.
 * Checks may be enabled or disabled for a whole package (with its subpackages) or for individual classes
 * like so: {@code -Dchk:io.groupmerge.reducer=on -Dchk:GroupCombiner=off}.
 */
public final class Checks {
	private static final String ENV_PREFIX = "chk:";

	private Checks() {
	}

	/**
	 * Indicates whether optional checks are enabled for the specified class.
	 * <p>
	 * The most specific setting wins: fully qualified class name, then simple class name,
	 * then enclosing packages from the innermost one, then the global {@code chk} property.
	 *
	 * @param cls class to be checked
	 * @return {@code true} if checks are enabled for the given class, {@code false} otherwise
	 */
	public static boolean isEnabled(Class<?> cls) {
		checkState(!cls.isAnonymousClass(), "Anonymous classes cannot be used for checks");

		String property;
		String path = cls.getName();
		if ((property = System.getProperty(ENV_PREFIX + path)) == null) {
			property = System.getProperty(ENV_PREFIX + cls.getSimpleName());
			while (property == null) {
				int idx = path.lastIndexOf('.');
				if (idx == -1) break;
				path = path.substring(0, idx);
				property = System.getProperty(ENV_PREFIX + path);
			}
		}
		return parse(property != null ? property : System.getProperty("chk"));
	}

	private static boolean parse(@Nullable String value) {
		if (value == null || value.equals("off")) return false;
		if (value.equals("on")) return true;
		throw new IllegalArgumentException("Only 'on' and 'off' values are allowed for 'chk' system properties, " +
				"was '" + value + '\'');
	}

	public static <T> T checkNotNull(@Nullable T reference) {
		if (reference != null) {
			return reference;
		}
		throw new NullPointerException();
	}

	public static <T> T checkNotNull(@Nullable T reference, Object message) {
		if (reference != null) {
			return reference;
		}
		throw new NullPointerException(String.valueOf(message));
	}

	public static void checkState(boolean expression) {
		if (!expression) {
			throw new IllegalStateException();
		}
	}

	public static void checkState(boolean expression, Object message) {
		if (!expression) {
			throw new IllegalStateException(String.valueOf(message));
		}
	}

	/**
	 * @throws IllegalStateException with a message built by {@link String#format(String, Object...)}
	 */
	public static void checkState(boolean expression, String template, Object... args) {
		if (!expression) {
			throw new IllegalStateException(String.format(template, args));
		}
	}

	public static void checkArgument(boolean expression) {
		if (!expression) {
			throw new IllegalArgumentException();
		}
	}

	/**
	 * @throws IllegalArgumentException with a message built by {@link String#format(String, Object...)}
	 */
	public static void checkArgument(boolean expression, String template, Object... args) {
		if (!expression) {
			throw new IllegalArgumentException(String.format(template, args));
		}
	}
}
