package org.beng183.sequences;

import java.util.regex.Pattern;

/**
 * The kind of a biological sequence, which determines its alphabet.
 * @author dmyersturnbull
 */
public enum SequenceKind {

	DNA("dna", "[ATGC]+"), RNA("rna", "[AUGC]+"), PROTEIN("protein", "[ACDEFGHIKLMNPQRSTVWY*]+");

	private final String name;
	private final Pattern alphabet;

	private SequenceKind(String name, String alphabet) {
		this.name = name;
		this.alphabet = Pattern.compile(alphabet);
	}

	public String getName() {
		return name;
	}

	/**
	 * Returns whether the whole of {@code sequence} is drawn from this alphabet.
	 * An empty sequence never matches.
	 */
	public boolean matches(String sequence) {
		return alphabet.matcher(sequence).matches();
	}

	public boolean isNucleotide() {
		return this != PROTEIN;
	}

	/**
	 * Looks up a kind by its name, ignoring case ("dna", "RNA", "Protein").
	 */
	public static SequenceKind forName(String name) {
		for (SequenceKind kind : values()) {
			if (kind.name.equalsIgnoreCase(name.trim())) return kind;
		}
		throw new IllegalArgumentException("No sequence kind " + name);
	}

}
