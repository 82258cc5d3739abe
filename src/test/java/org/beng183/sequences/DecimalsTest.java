package org.beng183.sequences;

import static org.junit.Assert.*;

import org.junit.Test;

public class DecimalsTest {

	private static final double PRECISION = Math.pow(2, -16);

	@Test
	public void testHalvesTowardPositiveInfinity() {
		assertEquals(-0.062, Decimals.round(-0.0625, 3), PRECISION);
		assertEquals(0.063, Decimals.round(0.0625, 3), PRECISION);
		assertEquals(-2.0, Decimals.round(-2.5, 0), PRECISION);
		assertEquals(66.67, Decimals.round(200.0 / 3, 2), PRECISION);
		assertEquals(94.9, Decimals.round(94.87179, 1), PRECISION);
	}

}
