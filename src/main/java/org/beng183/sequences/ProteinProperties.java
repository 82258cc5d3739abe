package org.beng183.sequences;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Residue composition and simple physicochemical estimates of a protein.
 * @author dmyersturnbull
 */
public final class ProteinProperties {

	private final int length;
	private final double molecularWeight;
	private final double isoelectricPoint;
	private final double hydropathy;
	private final Map<Character,Integer> composition;

	public ProteinProperties(int length, double molecularWeight, double isoelectricPoint, double hydropathy, Map<Character, Integer> composition) {
		this.length = length;
		this.molecularWeight = molecularWeight;
		this.isoelectricPoint = isoelectricPoint;
		this.hydropathy = hydropathy;
		this.composition = Collections.unmodifiableMap(new LinkedHashMap<>(composition));
	}

	/**
	 * The number of symbols, counting stops and unknown residues.
	 */
	public int getLength() {
		return length;
	}

	/**
	 * Sum of residue weights in Da, rounded to 2 decimals.
	 */
	public double getMolecularWeight() {
		return molecularWeight;
	}

	/**
	 * The estimate {@code 7 + 0.5 × (basic − acidic)}, not a titration; see {@link ProteinPropertyCalculator}.
	 */
	public double getIsoelectricPoint() {
		return isoelectricPoint;
	}

	/**
	 * Mean Kyte–Doolittle hydropathy over the standard residues.
	 */
	public double getHydropathy() {
		return hydropathy;
	}

	/**
	 * Symbol counts in order of first occurrence, including {@code *} and {@code X} if present.
	 */
	public Map<Character, Integer> getComposition() {
		return composition;
	}

	@Override
	public String toString() {
		return "ProteinProperties [length=" + length + ", molecularWeight=" + molecularWeight + ", isoelectricPoint=" + isoelectricPoint
				+ ", hydropathy=" + hydropathy + ", composition=" + composition + "]";
	}

}
