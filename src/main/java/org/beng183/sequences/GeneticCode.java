package org.beng183.sequences;

/**
 * Essentially, a mapping of 3-letter DNA codons to one-letter amino acids.
 * Stop codons map to {@link #STOP}; anything the code has no entry for maps to {@link #UNKNOWN}.
 * @author dmyersturnbull
 */
public interface GeneticCode {

	char STOP = '*';

	char UNKNOWN = 'X';

	char START = 'M';

	/**
	 * Returns the amino acid encoded by the given 3-letter codon, in the DNA alphabet (T, not U).
	 * Returns {@link #UNKNOWN} for anything that is not a codon of this code, including partial codons.
	 */
	char getAminoAcid(String codon);

	/**
	 * Returns the number of codons this code has entries for.
	 */
	int size();

}
