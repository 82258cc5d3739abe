package org.beng183.sequences;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base counts of a nucleotide sequence with its GC and AT (or AU) content and skews.
 * Contents are percentages rounded to 2 decimals; skews are rounded to 3.
 * @author dmyersturnbull
 */
public final class CompositionResult {

	private final Map<Character,Integer> composition;
	private final double gcContent;
	private final double atContent;
	private final double gcSkew;
	private final double atSkew;
	private final int length;

	public CompositionResult(Map<Character, Integer> composition, double gcContent, double atContent, double gcSkew, double atSkew, int length) {
		this.composition = Collections.unmodifiableMap(new LinkedHashMap<>(composition));
		this.gcContent = gcContent;
		this.atContent = atContent;
		this.gcSkew = gcSkew;
		this.atSkew = atSkew;
		this.length = length;
	}

	/**
	 * Counts keyed by A, T or U, G, C, in that order.
	 */
	public Map<Character, Integer> getComposition() {
		return composition;
	}

	public int getCount(char base) {
		return Counts.get(composition, base);
	}

	public double getGcContent() {
		return gcContent;
	}

	/**
	 * The A+T content, or A+U for RNA.
	 */
	public double getAtContent() {
		return atContent;
	}

	/**
	 * (G−C)/(G+C), or 0 if there is no G or C.
	 */
	public double getGcSkew() {
		return gcSkew;
	}

	public double getAtSkew() {
		return atSkew;
	}

	public int getLength() {
		return length;
	}

	@Override
	public String toString() {
		return "CompositionResult [composition=" + composition + ", gcContent=" + gcContent + ", atContent=" + atContent + ", gcSkew=" + gcSkew
				+ ", atSkew=" + atSkew + ", length=" + length + "]";
	}

}
