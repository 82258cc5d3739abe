package org.beng183.sequences;

/**
 * How a query sequence differs from its reference at one position.
 */
public enum MutationType {

	SUBSTITUTION("substitution"),

	/**
	 * The query has a symbol past the end of the reference.
	 */
	INSERTION("insertion"),

	/**
	 * The reference has a symbol past the end of the query.
	 */
	DELETION("deletion");

	private final String name;

	private MutationType(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

}
