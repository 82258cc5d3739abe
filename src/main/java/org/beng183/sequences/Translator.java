package org.beng183.sequences;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Translates nucleotide sequences through a {@link GeneticCode}.
 * @author dmyersturnbull
 */
public class Translator {

	public static final int N_FRAMES = 3;

	private static final Logger logger = LogManager.getLogger(Translator.class.getName());

	private final GeneticCode code;
	private final ProteinPropertyCalculator calculator;

	public Translator() {
		this(SimpleGeneticCode.standard());
	}

	public Translator(GeneticCode code) {
		this(code, new ProteinPropertyCalculator());
	}

	public Translator(GeneticCode code, ProteinPropertyCalculator calculator) {
		this.code = code;
		this.calculator = calculator;
	}

	/**
	 * Translates every complete codon starting at nucleotide offset {@code frame}.
	 * RNA is read as DNA. Stops are kept as {@code *} and codons without an entry become {@code X}.
	 * @param frame 0, 1, or 2
	 */
	public TranslationResult translate(String sequence, int frame, SequenceKind kind) {
		if (frame < 0 || frame >= N_FRAMES) {
			throw new IllegalArgumentException("Frame must be 0, 1, or 2, but was " + frame);
		}
		String cleanSeq = SequenceNormalizer.clean(sequence);
		if (SequenceNormalizer.isRna(cleanSeq, kind)) cleanSeq = SequenceNormalizer.toDna(cleanSeq);

		String protein = translateFrom(cleanSeq, frame);
		logger.debug("Translated " + cleanSeq.length() + " bases in frame " + frame + " to " + protein.length() + " residues");
		return new TranslationResult(frame, protein, calculator.calculate(protein));
	}

	public TranslationResult translate(NormalizedSequence sequence, int frame) {
		return translate(sequence.getSymbols(), frame, sequence.getKind());
	}

	/**
	 * Translates in each of the 3 forward frames, in order of offset.
	 */
	public List<TranslationResult> translateAllFrames(String sequence, SequenceKind kind) {
		List<TranslationResult> results = new ArrayList<>(N_FRAMES);
		for (int frame = 0; frame < N_FRAMES; frame++) {
			results.add(translate(sequence, frame, kind));
		}
		return results;
	}

	public List<TranslationResult> translateAllFrames(NormalizedSequence sequence) {
		return translateAllFrames(sequence.getSymbols(), sequence.getKind());
	}

	private String translateFrom(String dna, int offset) {
		StringBuilder sb = new StringBuilder(Math.max(0, dna.length() - offset) / 3);
		for (int i = offset; i + 3 <= dna.length(); i += 3) {
			sb.append(code.getAminoAcid(dna.substring(i, i + 3)));
		}
		return sb.toString();
	}

}
