package org.beng183.sequences;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Every analysis that applies to one sequence.
 * Nucleotide sequences have a composition, codon usage, translations and ORFs; proteins have protein properties.
 * Analyses that don't apply are null. The mutation analysis is null unless a reference was given.
 * @author dmyersturnbull
 */
public final class SequenceReport {

	private final NormalizedSequence sequence;
	private final CompositionResult composition;
	private final CodonUsageResult codonUsage;
	private final List<TranslationResult> translations;
	private final OrfSummary orfs;
	private final ProteinProperties proteinProperties;
	private final MutationAnalysis mutations;

	SequenceReport(NormalizedSequence sequence, CompositionResult composition, CodonUsageResult codonUsage, List<TranslationResult> translations,
			OrfSummary orfs, ProteinProperties proteinProperties, MutationAnalysis mutations) {
		this.sequence = sequence;
		this.composition = composition;
		this.codonUsage = codonUsage;
		this.translations = translations == null ? null : Collections.unmodifiableList(new ArrayList<>(translations));
		this.orfs = orfs;
		this.proteinProperties = proteinProperties;
		this.mutations = mutations;
	}

	public NormalizedSequence getSequence() {
		return sequence;
	}

	public CompositionResult getComposition() {
		return composition;
	}

	public CodonUsageResult getCodonUsage() {
		return codonUsage;
	}

	/**
	 * Translations in frames 0, 1 and 2.
	 */
	public List<TranslationResult> getTranslations() {
		return translations;
	}

	public OrfSummary getOrfs() {
		return orfs;
	}

	public ProteinProperties getProteinProperties() {
		return proteinProperties;
	}

	public MutationAnalysis getMutations() {
		return mutations;
	}

}
