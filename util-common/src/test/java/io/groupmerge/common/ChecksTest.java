package io.groupmerge.common;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static io.groupmerge.common.Checks.*;
import static org.junit.Assert.*;

public final class ChecksTest {
	@Before
	public void setUp() {
		clearChecksProperties();
		System.setProperty("chk", "on");
	}

	@After
	public void tearDown() {
		clearChecksProperties();
	}

	private static void clearChecksProperties() {
		System.getProperties().stringPropertyNames().stream()
				.filter(s -> s.startsWith("chk"))
				.forEach(System::clearProperty);
	}

	@Test
	public void testDisabledByDefault() {
		System.clearProperty("chk");
		assertFalse(Checks.isEnabled(ChecksTest.class));
	}

	@Test
	public void testDisablingClass() {
		assertTrue(Checks.isEnabled(ChecksTest.class));

		System.setProperty("chk:" + ChecksTest.class.getName(), "off");
		assertFalse(Checks.isEnabled(ChecksTest.class));
	}

	@Test
	public void testDisablingClassBySimpleName() {
		assertTrue(Checks.isEnabled(ChecksTest.class));

		System.setProperty("chk:" + ChecksTest.class.getSimpleName(), "off");
		assertFalse(Checks.isEnabled(ChecksTest.class));
	}

	@Test
	public void testDisablingPackageButEnablingClass() {
		System.setProperty("chk:java.util", "off");
		assertFalse(Checks.isEnabled(List.class));
		assertFalse(Checks.isEnabled(ArrayList.class));

		System.setProperty("chk:java.util.ArrayList", "on");
		assertFalse(Checks.isEnabled(List.class));
		assertTrue(Checks.isEnabled(ArrayList.class));
	}

	@Test
	public void testDisablingPackageButEnablingSubpackage() {
		System.setProperty("chk:java.util", "off");
		assertFalse(Checks.isEnabled(Function.class));

		System.setProperty("chk:java.util.function", "on");
		assertFalse(Checks.isEnabled(List.class));
		assertTrue(Checks.isEnabled(Function.class));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMalformedValue() {
		System.setProperty("chk", "yes");
		Checks.isEnabled(ChecksTest.class);
	}

	@Test(expected = IllegalStateException.class)
	public void testAnonymousClass() {
		Checks.isEnabled(new Object() {}.getClass());
	}

	@Test
	public void testPreconditions() {
		assertEquals("value", checkNotNull("value"));

		NullPointerException npe = assertThrows(NullPointerException.class, () -> checkNotNull(null, "missing"));
		assertEquals("missing", npe.getMessage());

		IllegalArgumentException iae = assertThrows(IllegalArgumentException.class,
				() -> checkArgument(false, "bad %s", 42));
		assertEquals("bad 42", iae.getMessage());

		IllegalStateException ise = assertThrows(IllegalStateException.class,
				() -> checkState(false, "state %s", "broken"));
		assertEquals("state broken", ise.getMessage());
	}
}
