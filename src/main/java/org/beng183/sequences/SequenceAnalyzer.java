package org.beng183.sequences;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Normalizes and validates raw input, then runs every analysis that applies to its kind.
 * Unlike the individual analyses, this rejects input that is not valid for its declared kind.
 * @author dmyersturnbull
 */
public class SequenceAnalyzer {

	private static final Logger logger = LogManager.getLogger(SequenceAnalyzer.class.getName());

	private final CompositionAnalyzer compositionAnalyzer;
	private final CodonUsageAnalyzer codonUsageAnalyzer;
	private final Translator translator;
	private final OrfFinder orfFinder;
	private final MutationComparator mutationComparator;
	private final ProteinPropertyCalculator proteinCalculator;

	public SequenceAnalyzer() {
		this(SimpleGeneticCode.standard());
	}

	public SequenceAnalyzer(GeneticCode code) {
		this.compositionAnalyzer = new CompositionAnalyzer();
		this.codonUsageAnalyzer = new CodonUsageAnalyzer(code);
		this.proteinCalculator = new ProteinPropertyCalculator();
		this.translator = new Translator(code, proteinCalculator);
		this.orfFinder = new OrfFinder(code);
		this.mutationComparator = new MutationComparator(code);
	}

	public SequenceReport analyze(String raw, SequenceKind kind) throws AnalysisException {
		return analyze(raw, kind, null);
	}

	/**
	 * @param referenceRaw A reference to compare against, in the same kind; ignored if null or blank
	 * @throws AnalysisException If the sequence or the reference is not valid for {@code kind} once normalized
	 */
	public SequenceReport analyze(String raw, SequenceKind kind, String referenceRaw) throws AnalysisException {

		NormalizedSequence sequence = normalizeValid(raw, kind, "Sequence");
		logger.info("Analyzing " + kind.getName() + " sequence of length " + sequence.length());

		CompositionResult composition = null;
		CodonUsageResult codonUsage = null;
		List<TranslationResult> translations = null;
		OrfSummary orfs = null;
		ProteinProperties proteinProperties = null;
		if (kind.isNucleotide()) {
			composition = compositionAnalyzer.composition(sequence);
			codonUsage = codonUsageAnalyzer.codonUsage(sequence);
			translations = translator.translateAllFrames(sequence);
			orfs = orfFinder.summarize(sequence);
		} else {
			proteinProperties = proteinCalculator.calculate(sequence.getSymbols());
		}

		MutationAnalysis mutations = null;
		if (referenceRaw != null && !referenceRaw.trim().isEmpty()) {
			NormalizedSequence reference = normalizeValid(referenceRaw, kind, "Reference");
			mutations = mutationComparator.compare(reference, sequence);
			logger.info("Found " + mutations.getTotalMutations() + " mutations against a reference of length " + reference.length());
		}

		return new SequenceReport(sequence, composition, codonUsage, translations, orfs, proteinProperties, mutations);
	}

	private static NormalizedSequence normalizeValid(String raw, SequenceKind kind, String what) throws AnalysisException {
		if (kind == null) throw new IllegalArgumentException("A sequence kind is required");
		NormalizedSequence sequence = SequenceNormalizer.normalize(raw, kind);
		if (sequence.isEmpty()) {
			throw new AnalysisException(what + " is empty");
		}
		if (!sequence.isValid()) {
			throw new AnalysisException(what + " contains symbols that are not valid " + kind.getName() + " (" + abbreviate(sequence.getSymbols()) + ")");
		}
		return sequence;
	}

	private static String abbreviate(String symbols) {
		if (symbols.length() <= 20) return symbols;
		return symbols.substring(0, 20) + "...";
	}

}
