package org.beng183.sequences;

/**
 * The 20 standard amino acids with the physicochemical values used for protein properties.
 * Weights are average residue masses in Da; hydropathy is the Kyte–Doolittle scale;
 * {@link #getIsoelectricPoint()} is the free amino acid's pI.
 * @author dmyersturnbull
 */
public enum AminoAcid {

	ALANINE('A', 89.1, 6.0, 1.8),
	ARGININE('R', 174.2, 10.8, -4.5),
	ASPARAGINE('N', 132.1, 5.4, -3.5),
	ASPARTIC_ACID('D', 133.1, 2.8, -3.5),
	CYSTEINE('C', 121.2, 5.1, 2.5),
	GLUTAMINE('Q', 146.1, 5.7, -3.5),
	GLUTAMIC_ACID('E', 147.1, 4.3, -3.5),
	GLYCINE('G', 75.1, 6.0, -0.4),
	HISTIDINE('H', 155.2, 7.6, -3.2),
	ISOLEUCINE('I', 131.2, 6.0, 4.5),
	LEUCINE('L', 131.2, 6.0, 3.8),
	LYSINE('K', 146.2, 9.7, -3.9),
	METHIONINE('M', 149.2, 5.7, 1.9),
	PHENYLALANINE('F', 165.2, 5.5, 2.8),
	PROLINE('P', 115.1, 6.3, -1.6),
	SERINE('S', 105.1, 5.7, -0.8),
	THREONINE('T', 119.1, 5.6, -0.7),
	TRYPTOPHAN('W', 204.2, 5.9, -0.9),
	TYROSINE('Y', 181.2, 5.7, -1.3),
	VALINE('V', 117.1, 6.0, 4.2);

	private static final AminoAcid[] byLetter = new AminoAcid[128];

	static {
		for (AminoAcid aminoAcid : values()) {
			byLetter[aminoAcid.letter] = aminoAcid;
		}
	}

	private final char letter;
	private final double weight;
	private final double isoelectricPoint;
	private final double hydropathy;

	private AminoAcid(char letter, double weight, double isoelectricPoint, double hydropathy) {
		this.letter = letter;
		this.weight = weight;
		this.isoelectricPoint = isoelectricPoint;
		this.hydropathy = hydropathy;
	}

	/**
	 * Returns the amino acid for an uppercase one-letter code, or null for anything else (including {@code *} and {@code X}).
	 */
	public static AminoAcid forLetter(char letter) {
		if (letter >= byLetter.length) return null;
		return byLetter[letter];
	}

	public char getLetter() {
		return letter;
	}

	public double getWeight() {
		return weight;
	}

	public double getIsoelectricPoint() {
		return isoelectricPoint;
	}

	public double getHydropathy() {
		return hydropathy;
	}

	/**
	 * R, K and H.
	 */
	public boolean isBasic() {
		return this == ARGININE || this == LYSINE || this == HISTIDINE;
	}

	/**
	 * D and E.
	 */
	public boolean isAcidic() {
		return this == ASPARTIC_ACID || this == GLUTAMIC_ACID;
	}

}
