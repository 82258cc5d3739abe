package org.beng183.sequences;

/**
 * The coding consequence of a {@link Mutation}.
 */
public enum MutationEffect {

	SYNONYMOUS("synonymous"), MISSENSE("missense"), NONSENSE("nonsense"), FRAMESHIFT("frameshift");

	private final String name;

	private MutationEffect(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

}
