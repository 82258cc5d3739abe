package org.beng183.sequences;

/**
 * Rounding of reported values to a fixed number of decimals.
 */
final class Decimals {

	private Decimals() {
	}

	/**
	 * Rounds to {@code places} decimals with halves going toward positive infinity, as {@link Math#round(double)} does:
	 * -0.0625 becomes -0.062, and 0.0625 becomes 0.063.
	 */
	static double round(double value, int places) {
		double factor = Math.pow(10, places);
		return Math.round(value * factor) / factor;
	}

}
