package org.beng183.sequences;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Compares a query against a reference position by position.
 * <p>
 * This is <em>not</em> an alignment: position i of one sequence is only ever compared with position i of the other,
 * so a single indel shifts everything after it and shows up as a run of substitutions.
 * Positions past the end of the shorter sequence are insertions (query longer) or deletions (reference longer),
 * always with a {@link MutationEffect#FRAMESHIFT frameshift} effect.
 * </p>
 * The effect of a substitution is found by translating the codon containing it, at {@code ⌊i/3⌋×3}, in both sequences:
 * <ul>
 * <li>same amino acid: {@link MutationEffect#SYNONYMOUS synonymous}</li>
 * <li>the query's codon is a stop: {@link MutationEffect#NONSENSE nonsense}</li>
 * <li>otherwise, or if either codon runs off the end of its sequence: {@link MutationEffect#MISSENSE missense}</li>
 * </ul>
 * @author dmyersturnbull
 */
public class MutationComparator {

	private static final Logger logger = LogManager.getLogger(MutationComparator.class.getName());

	private final GeneticCode code;

	public MutationComparator() {
		this(SimpleGeneticCode.standard());
	}

	public MutationComparator(GeneticCode code) {
		this.code = code;
	}

	public MutationAnalysis compare(String reference, String query) {

		String ref = SequenceNormalizer.clean(reference);
		String qry = SequenceNormalizer.clean(query);
		int maxLength = Math.max(ref.length(), qry.length());

		List<Mutation> mutations = new ArrayList<>();
		for (int i = 0; i < maxLength; i++) {
			boolean inRef = i < ref.length();
			boolean inQuery = i < qry.length();
			if (inRef && inQuery) {
				char original = ref.charAt(i);
				char mutated = qry.charAt(i);
				if (original == mutated) continue;
				MutationEffect effect = substitutionEffect(ref, qry, i);
				mutations.add(new Mutation(i, String.valueOf(original), String.valueOf(mutated), MutationType.SUBSTITUTION, effect));
			} else if (inQuery) {
				mutations.add(new Mutation(i, "", String.valueOf(qry.charAt(i)), MutationType.INSERTION, MutationEffect.FRAMESHIFT));
			} else {
				mutations.add(new Mutation(i, String.valueOf(ref.charAt(i)), "", MutationType.DELETION, MutationEffect.FRAMESHIFT));
			}
		}

		double rate = maxLength == 0 ? 0 : (double) mutations.size() / maxLength * 100;
		logger.debug("Found " + mutations.size() + " mutations over " + maxLength + " positions");
		return new MutationAnalysis(mutations, rate);
	}

	public MutationAnalysis compare(NormalizedSequence reference, NormalizedSequence query) {
		return compare(reference.getSymbols(), query.getSymbols());
	}

	private MutationEffect substitutionEffect(String ref, String qry, int position) {
		int codonStart = position / 3 * 3;
		if (codonStart + 3 > ref.length() || codonStart + 3 > qry.length()) {
			return MutationEffect.MISSENSE;
		}
		char original = translate(ref.substring(codonStart, codonStart + 3));
		char mutated = translate(qry.substring(codonStart, codonStart + 3));
		if (original == mutated) return MutationEffect.SYNONYMOUS;
		if (mutated == GeneticCode.STOP) return MutationEffect.NONSENSE;
		return MutationEffect.MISSENSE;
	}

	private char translate(String codon) {
		return code.getAminoAcid(SequenceNormalizer.toDna(codon));
	}

}
