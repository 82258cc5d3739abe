package org.beng183.sequences;

/**
 * A start-to-stop span in one forward reading frame.
 * @author dmyersturnbull
 */
public final class OpenReadingFrame {

	private final int start;
	private final int end;
	private final int frame;
	private final String protein;

	public OpenReadingFrame(int start, int end, int frame, String protein) {
		this.start = start;
		this.end = end;
		this.frame = frame;
		this.protein = protein;
	}

	/**
	 * The 0-based index of the first base of the start codon.
	 */
	public int getStart() {
		return start;
	}

	/**
	 * The 0-based index of the last base of the stop codon.
	 */
	public int getEnd() {
		return end;
	}

	/**
	 * The frame number for display: 1, 2, or 3 (offset + 1).
	 */
	public int getFrame() {
		return frame;
	}

	/**
	 * The translated protein from the start codon up to, but excluding, the stop.
	 */
	public String getProtein() {
		return protein;
	}

	public int getProteinLength() {
		return protein.length();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (!(obj instanceof OpenReadingFrame)) return false;
		OpenReadingFrame other = (OpenReadingFrame) obj;
		return start == other.start && end == other.end && frame == other.frame && protein.equals(other.protein);
	}

	@Override
	public int hashCode() {
		int result = start;
		result = 31 * result + end;
		result = 31 * result + frame;
		return 31 * result + protein.hashCode();
	}

	@Override
	public String toString() {
		return "OpenReadingFrame [start=" + start + ", end=" + end + ", frame=" + frame + ", protein=" + protein + "]";
	}

}
