package org.beng183.sequences;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Recovers a usable sequence from loosely formatted text, and checks sequences against their alphabets.
 * Normalization is permissive; validation is a separate step that callers run before analyzing.
 * @author dmyersturnbull
 */
public final class SequenceNormalizer {

	private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");
	private static final Pattern NON_LETTER = Pattern.compile("[^A-Za-z]");
	private static final Pattern WHITESPACE = Pattern.compile("\\s");

	private SequenceNormalizer() {
	}

	/**
	 * Strips FASTA header lines (those starting with {@code >}, ignoring leading whitespace), removes everything that is not a letter,
	 * uppercases, and harmonizes T and U with the declared kind: T becomes U for RNA, and U becomes T for DNA.
	 * Applying this twice gives the same result as applying it once.
	 */
	public static NormalizedSequence normalize(String raw, SequenceKind kind) {
		if (kind == null) throw new IllegalArgumentException("A sequence kind is required");
		if (raw == null || raw.isEmpty()) return new NormalizedSequence("", kind);
		StringBuilder sb = new StringBuilder(raw.length());
		for (String line : LINE_BREAK.split(raw, -1)) {
			if (line.trim().startsWith(">")) continue;
			sb.append(line);
		}
		String seq = clean(sb.toString());
		if (kind == SequenceKind.RNA) {
			seq = toRna(seq);
		} else if (kind == SequenceKind.DNA) {
			seq = toDna(seq);
		}
		return new NormalizedSequence(seq, kind);
	}

	/**
	 * Returns true iff the sequence, once whitespace is removed and it is uppercased, is non-empty and entirely in the alphabet of {@code kind}:
	 * {@code [ATGC]} for DNA, {@code [AUGC]} for RNA, and the 20 standard residues plus {@code *} for protein.
	 */
	public static boolean validate(String sequence, SequenceKind kind) {
		if (sequence == null || kind == null) return false;
		String cleanSeq = WHITESPACE.matcher(sequence).replaceAll("").toUpperCase(Locale.ROOT);
		return kind.matches(cleanSeq);
	}

	/**
	 * Keeps only letters, uppercased.
	 */
	public static String clean(String sequence) {
		return NON_LETTER.matcher(sequence).replaceAll("").toUpperCase(Locale.ROOT);
	}

	public static String toDna(String sequence) {
		return sequence.replace('U', 'T');
	}

	public static String toRna(String sequence) {
		return sequence.replace('T', 'U');
	}

	/**
	 * Returns whether the sequence should be read as RNA: either it is declared so, or it contains U regardless of what was declared.
	 */
	static boolean isRna(String cleanSeq, SequenceKind kind) {
		return kind == SequenceKind.RNA || cleanSeq.indexOf('U') >= 0;
	}

}
