package io.groupmerge.common;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.Properties;

import static org.junit.Assert.*;

public class ApplicationSettingsTest {
	@Before
	public void setUp() {
		ApplicationSettings.reset();
	}

	@After
	public void tearDown() {
		ApplicationSettings.reset();
	}

	@Test
	public void testDefaultValue() {
		assertEquals(7, ApplicationSettings.getInt(ApplicationSettingsTest.class, "missing", 7));
	}

	@Test
	public void testLookupByFullAndSimpleName() {
		Properties properties = new Properties();
		properties.setProperty(ApplicationSettingsTest.class.getName() + ".batch", "100");
		properties.setProperty("ApplicationSettingsTest.verbose", "true");
		ApplicationSettings.useProperties(properties);

		assertEquals(100, ApplicationSettings.getInt(ApplicationSettingsTest.class, "batch", 0));
		assertTrue(ApplicationSettings.getBoolean(ApplicationSettingsTest.class, "verbose", false));
		assertEquals(5L, ApplicationSettings.getLong(ApplicationSettingsTest.class, "other", 5L));
	}

	@Test
	public void testCustomSettingOverridesProperties() {
		Properties properties = new Properties();
		properties.setProperty("ApplicationSettingsTest.name", "fromProperties");
		ApplicationSettings.useProperties(properties);
		ApplicationSettings.set(ApplicationSettingsTest.class, "name", "custom");

		assertEquals("custom", ApplicationSettings.getString(ApplicationSettingsTest.class, "name", "default"));
	}

	@Test
	public void testCannotChangeAfterLookup() {
		ApplicationSettings.getInt(ApplicationSettingsTest.class, "any", 0);

		assertThrows(IllegalStateException.class,
				() -> ApplicationSettings.set(ApplicationSettingsTest.class, "any", 1));
		assertThrows(IllegalStateException.class,
				() -> ApplicationSettings.useProperties(new Properties()));
	}
}
