package org.beng183.sequences;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The ORFs of a sequence with a few aggregates over them.
 * @author dmyersturnbull
 */
public final class OrfSummary {

	private final List<OpenReadingFrame> orfs;
	private final int sequenceLength;
	private final double coverage;
	private final Map<Integer,Integer> frameDistribution;

	public OrfSummary(List<OpenReadingFrame> orfs, int sequenceLength, double coverage, Map<Integer, Integer> frameDistribution) {
		this.orfs = Collections.unmodifiableList(new ArrayList<>(orfs));
		this.sequenceLength = sequenceLength;
		this.coverage = coverage;
		this.frameDistribution = Collections.unmodifiableMap(new LinkedHashMap<>(frameDistribution));
	}

	/**
	 * Longest protein first.
	 */
	public List<OpenReadingFrame> getOrfs() {
		return orfs;
	}

	public int getTotalOrfs() {
		return orfs.size();
	}

	/**
	 * Returns the ORF with the longest protein, or null if there are none.
	 */
	public OpenReadingFrame getLongest() {
		return orfs.isEmpty() ? null : orfs.get(0);
	}

	public int getSequenceLength() {
		return sequenceLength;
	}

	/**
	 * The summed {@code end − start} of all ORFs as a percentage of the sequence length, rounded to 1 decimal.
	 * ORFs in different frames may overlap, so this can exceed 100.
	 */
	public double getCoverage() {
		return coverage;
	}

	/**
	 * Frame number (1-3) to the number of ORFs in that frame, in ascending frame order. Frames without ORFs are absent.
	 */
	public Map<Integer, Integer> getFrameDistribution() {
		return frameDistribution;
	}

	@Override
	public String toString() {
		return "OrfSummary [totalOrfs=" + orfs.size() + ", sequenceLength=" + sequenceLength + ", coverage=" + coverage
				+ ", frameDistribution=" + frameDistribution + "]";
	}

}
