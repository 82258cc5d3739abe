package org.beng183.sequences;

import java.util.Map;

/**
 * A protein translated from one reading frame, with its properties.
 * Stop codons appear as {@code *} in the protein; translation does not stop at them.
 * @author dmyersturnbull
 */
public final class TranslationResult {

	private final int frame;
	private final String protein;
	private final ProteinProperties properties;

	public TranslationResult(int frame, String protein, ProteinProperties properties) {
		this.frame = frame;
		this.protein = protein;
		this.properties = properties;
	}

	/**
	 * The 0-based nucleotide offset translation started from.
	 */
	public int getFrame() {
		return frame;
	}

	public String getProtein() {
		return protein;
	}

	public int getLength() {
		return protein.length();
	}

	public ProteinProperties getProperties() {
		return properties;
	}

	public double getMolecularWeight() {
		return properties.getMolecularWeight();
	}

	public double getIsoelectricPoint() {
		return properties.getIsoelectricPoint();
	}

	public double getHydropathy() {
		return properties.getHydropathy();
	}

	public Map<Character, Integer> getComposition() {
		return properties.getComposition();
	}

	@Override
	public String toString() {
		return "TranslationResult [frame=" + frame + ", protein=" + protein + ", properties=" + properties + "]";
	}

}
