package org.beng183.sequences;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The mutations found between two sequences, in order of position.
 * @author dmyersturnbull
 */
public final class MutationAnalysis {

	private final List<Mutation> mutations;
	private final double mutationRate;

	public MutationAnalysis(List<Mutation> mutations, double mutationRate) {
		this.mutations = Collections.unmodifiableList(new ArrayList<>(mutations));
		this.mutationRate = mutationRate;
	}

	public List<Mutation> getMutations() {
		return mutations;
	}

	public int getTotalMutations() {
		return mutations.size();
	}

	/**
	 * Mutations per 100 positions of the longer sequence; 0 if both are empty.
	 */
	public double getMutationRate() {
		return mutationRate;
	}

	public int count(MutationType type) {
		int n = 0;
		for (Mutation mutation : mutations) {
			if (mutation.getType() == type) n++;
		}
		return n;
	}

	public int count(MutationEffect effect) {
		int n = 0;
		for (Mutation mutation : mutations) {
			if (mutation.getEffect() == effect) n++;
		}
		return n;
	}

	@Override
	public String toString() {
		return "MutationAnalysis [totalMutations=" + mutations.size() + ", mutationRate=" + mutationRate + "]";
	}

}
