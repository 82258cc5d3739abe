package org.beng183.sequences;

/**
 * A header-free, uppercased sequence together with its declared kind.
 * Produced by {@link SequenceNormalizer#normalize(String, SequenceKind)}, which does not validate; see {@link #isValid()}.
 * @author dmyersturnbull
 */
public final class NormalizedSequence {

	private final String symbols;
	private final SequenceKind kind;

	public NormalizedSequence(String symbols, SequenceKind kind) {
		if (symbols == null || kind == null) throw new IllegalArgumentException("Symbols and kind are required");
		this.symbols = symbols;
		this.kind = kind;
	}

	public String getSymbols() {
		return symbols;
	}

	public SequenceKind getKind() {
		return kind;
	}

	public int length() {
		return symbols.length();
	}

	public boolean isEmpty() {
		return symbols.isEmpty();
	}

	/**
	 * Returns whether every symbol belongs to the alphabet of the declared kind.
	 */
	public boolean isValid() {
		return SequenceNormalizer.validate(symbols, kind);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (!(obj instanceof NormalizedSequence)) return false;
		NormalizedSequence other = (NormalizedSequence) obj;
		return kind == other.kind && symbols.equals(other.symbols);
	}

	@Override
	public int hashCode() {
		return 31 * kind.hashCode() + symbols.hashCode();
	}

	@Override
	public String toString() {
		return kind.getName() + ":" + symbols;
	}

}
