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

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;

import static io.groupmerge.common.Checks.checkState;
import static java.util.Collections.emptyMap;

/**
 * A class for initializing runtime constants
 * <p>
 * Each application setting provides a name of a class, a name of a setting, and a default value to be
 * used in case a setting is not explicitly set
 * <p>
 * A setting is searched by using both fully qualified class name and a class's simple name,
 * e.g. {@code -Dio.groupmerge.reducer.GroupReduceRunner.logEvery=1000} or {@code -DGroupReduceRunner.logEvery=1000}
 * <p>
 * By default, system properties are searched to find whether a setting is explicitly set.
 * However, alternative properties may be used as a source.
 * Individual settings may also be set programmatically.
 * <p>
 * After any setting has been looked up it is not allowed to change properties source or
 * update individual settings.
 */
public final class ApplicationSettings {
	private static final Map<Class<?>, Map<String, Object>> customSettings = new HashMap<>();

	private static Properties properties = System.getProperties();
	private static volatile boolean firstLookupDone = false;

	private ApplicationSettings() {
	}

	/**
	 * Uses alternative properties to look up settings
	 *
	 * @param properties alternative properties
	 */
	public static void useProperties(Properties properties) {
		ensureNotLookedUp();
		ApplicationSettings.properties = properties;
	}

	/**
	 * Sets a custom setting which overrides settings from properties
	 *
	 * @param type  a class referenced by a setting
	 * @param name  a name of a setting
	 * @param value a value of a setting
	 */
	public static void set(Class<?> type, String name, Object value) {
		ensureNotLookedUp();
		customSettings.computeIfAbsent(type, $ -> new HashMap<>()).put(name, value);
	}

	/**
	 * Retrieves a setting, parsing a property string into an arbitrary value
	 *
	 * @param parser   function that transforms a setting string into a value
	 * @param type     a class referenced by a setting
	 * @param name     a name of a setting
	 * @param defValue default value that will be used if a setting property is not found
	 */
	public static <T> T get(Function<String, T> parser, Class<?> type, String name, T defValue) {
		checkState(!type.isAnonymousClass(), "Anonymous classes cannot be used for application settings");

		firstLookupDone = true;
		//noinspection unchecked
		T customSetting = (T) customSettings.getOrDefault(type, emptyMap()).get(name);
		if (customSetting != null) {
			return customSetting;
		}
		String property = getProperty(type, name);
		if (property != null) {
			return parser.apply(property);
		}
		return defValue;
	}

	public static String getString(Class<?> type, String name, String defValue) {
		return get(Function.identity(), type, name, defValue);
	}

	public static int getInt(Class<?> type, String name, int defValue) {
		return get(Integer::parseInt, type, name, defValue);
	}

	public static long getLong(Class<?> type, String name, long defValue) {
		return get(Long::parseLong, type, name, defValue);
	}

	public static boolean getBoolean(Class<?> type, String name, boolean defValue) {
		return get(s -> s.trim().isEmpty() || Boolean.parseBoolean(s), type, name, defValue);
	}

	private static String getProperty(Class<?> type, String name) {
		String property = properties.getProperty(type.getName() + "." + name);
		if (property != null) return property;
		return properties.getProperty(type.getSimpleName() + "." + name);
	}

	private static void ensureNotLookedUp() {
		checkState(!firstLookupDone, "Settings have already been looked up");
	}

	// visible for tests
	static synchronized void reset() {
		customSettings.clear();
		properties = System.getProperties();
		firstLookupDone = false;
	}
}
