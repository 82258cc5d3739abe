package org.beng183.sequences;

/**
 * A single positional difference between a reference and a query.
 * @author dmyersturnbull
 */
public final class Mutation {

	private final int position;
	private final String original;
	private final String mutated;
	private final MutationType type;
	private final MutationEffect effect;

	public Mutation(int position, String original, String mutated, MutationType type, MutationEffect effect) {
		this.position = position;
		this.original = original;
		this.mutated = mutated;
		this.type = type;
		this.effect = effect;
	}

	/**
	 * The 0-based position in both sequences.
	 */
	public int getPosition() {
		return position;
	}

	/**
	 * The reference symbol, or the empty string for an insertion.
	 */
	public String getOriginal() {
		return original;
	}

	/**
	 * The query symbol, or the empty string for a deletion.
	 */
	public String getMutated() {
		return mutated;
	}

	public MutationType getType() {
		return type;
	}

	public MutationEffect getEffect() {
		return effect;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (!(obj instanceof Mutation)) return false;
		Mutation other = (Mutation) obj;
		return position == other.position && original.equals(other.original) && mutated.equals(other.mutated) && type == other.type
				&& effect == other.effect;
	}

	@Override
	public int hashCode() {
		int result = position;
		result = 31 * result + original.hashCode();
		result = 31 * result + mutated.hashCode();
		result = 31 * result + type.hashCode();
		return 31 * result + effect.hashCode();
	}

	@Override
	public String toString() {
		return type.getName() + " " + original + position + mutated + " (" + effect.getName() + ")";
	}

}
