package org.beng183.sequences;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Codon and amino acid counts of a nucleotide sequence read in frame 0.
 * Codons are keyed in the alphabet of the input, so RNA codons contain U. Maps iterate in order of first occurrence.
 * @author dmyersturnbull
 */
public final class CodonUsageResult {

	private final Map<String,Integer> codons;
	private final Map<Character,Integer> aminoAcids;
	private final int totalCodons;
	private final List<String> mostFrequent;
	private final List<String> leastFrequent;
	private final double codonBias;

	public CodonUsageResult(Map<String, Integer> codons, Map<Character, Integer> aminoAcids, int totalCodons, List<String> mostFrequent,
			List<String> leastFrequent, double codonBias) {
		this.codons = Collections.unmodifiableMap(new LinkedHashMap<>(codons));
		this.aminoAcids = Collections.unmodifiableMap(new LinkedHashMap<>(aminoAcids));
		this.totalCodons = totalCodons;
		this.mostFrequent = Collections.unmodifiableList(new ArrayList<>(mostFrequent));
		this.leastFrequent = Collections.unmodifiableList(new ArrayList<>(leastFrequent));
		this.codonBias = codonBias;
	}

	public Map<String, Integer> getCodons() {
		return codons;
	}

	public Map<Character, Integer> getAminoAcids() {
		return aminoAcids;
	}

	public int getTotalCodons() {
		return totalCodons;
	}

	/**
	 * Up to 5 codons with the highest counts, highest first; ties keep order of first occurrence.
	 */
	public List<String> getMostFrequent() {
		return mostFrequent;
	}

	/**
	 * The last (up to) 5 codons of the same ranking as {@link #getMostFrequent()}, still in ranked order.
	 */
	public List<String> getLeastFrequent() {
		return leastFrequent;
	}

	/**
	 * Mean absolute deviation of the observed codon frequencies from the uniform 1/64, over codons that occur.
	 */
	public double getCodonBias() {
		return codonBias;
	}

	@Override
	public String toString() {
		return "CodonUsageResult [totalCodons=" + totalCodons + ", mostFrequent=" + mostFrequent + ", leastFrequent=" + leastFrequent
				+ ", codonBias=" + codonBias + "]";
	}

}
