package org.beng183.sequences;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Finds open reading frames in the 3 forward frames of a nucleotide sequence.
 * An ORF opens at an ATG and closes at the next in-frame stop codon; it is reported only if
 * its protein has at least {@link #MIN_PROTEIN_LENGTH} residues. An ORF that never reaches a stop is discarded.
 * Frames are scanned independently, so ORFs from different frames may overlap.
 * @author dmyersturnbull
 */
public class OrfFinder {

	public static final int MIN_PROTEIN_LENGTH = 5;

	private static final Logger logger = LogManager.getLogger(OrfFinder.class.getName());

	private static final Comparator<OpenReadingFrame> LONGEST_FIRST = new Comparator<OpenReadingFrame>() {
		@Override
		public int compare(OpenReadingFrame o1, OpenReadingFrame o2) {
			return Integer.compare(o2.getProteinLength(), o1.getProteinLength());
		}
	};

	private final GeneticCode code;

	public OrfFinder() {
		this(SimpleGeneticCode.standard());
	}

	public OrfFinder(GeneticCode code) {
		this.code = code;
	}

	/**
	 * Returns the ORFs sorted by protein length, longest first.
	 * Equal lengths stay in discovery order: by frame, then by position.
	 */
	public List<OpenReadingFrame> findOrfs(String sequence, SequenceKind kind) {

		List<OpenReadingFrame> orfs = new ArrayList<>();
		if (sequence == null) return orfs;

		String cleanSeq = SequenceNormalizer.clean(sequence);
		if (SequenceNormalizer.isRna(cleanSeq, kind)) cleanSeq = SequenceNormalizer.toDna(cleanSeq);

		for (int frame = 0; frame < Translator.N_FRAMES; frame++) {
			scanFrame(cleanSeq, frame, orfs);
		}

		Collections.sort(orfs, LONGEST_FIRST);
		logger.debug("Found " + orfs.size() + " ORFs in " + cleanSeq.length() + " bases");
		return orfs;
	}

	public List<OpenReadingFrame> findOrfs(NormalizedSequence sequence) {
		return findOrfs(sequence.getSymbols(), sequence.getKind());
	}

	/**
	 * Finds the ORFs and summarizes them.
	 */
	public OrfSummary summarize(String sequence, SequenceKind kind) {
		List<OpenReadingFrame> orfs = findOrfs(sequence, kind);
		int length = sequence == null ? 0 : SequenceNormalizer.clean(sequence).length();
		int covered = 0;
		int[] perFrame = new int[Translator.N_FRAMES + 1];
		for (OpenReadingFrame orf : orfs) {
			covered += orf.getEnd() - orf.getStart();
			perFrame[orf.getFrame()]++;
		}
		Map<Integer,Integer> frameDistribution = new LinkedHashMap<>();
		for (int frame = 1; frame <= Translator.N_FRAMES; frame++) {
			if (perFrame[frame] > 0) frameDistribution.put(frame, perFrame[frame]);
		}
		double coverage = length == 0 ? 0 : Decimals.round((double) covered / length * 100, 1);
		return new OrfSummary(orfs, length, coverage, frameDistribution);
	}

	public OrfSummary summarize(NormalizedSequence sequence) {
		return summarize(sequence.getSymbols(), sequence.getKind());
	}

	private void scanFrame(String dna, int frame, List<OpenReadingFrame> orfs) {
		StringBuilder protein = null;
		int start = -1;
		for (int i = frame; i + 3 <= dna.length(); i += 3) {
			char aminoAcid = code.getAminoAcid(dna.substring(i, i + 3));
			if (protein == null) {
				if (aminoAcid == GeneticCode.START) {
					start = i;
					protein = new StringBuilder().append(aminoAcid);
				}
			} else if (aminoAcid == GeneticCode.STOP) {
				if (protein.length() >= MIN_PROTEIN_LENGTH) {
					orfs.add(new OpenReadingFrame(start, i + 2, frame + 1, protein.toString()));
				} else {
					logger.trace("Dropping ORF at " + start + " in frame " + (frame + 1) + " with only " + protein.length() + " residues");
				}
				protein = null;
				start = -1;
			} else if (aminoAcid != GeneticCode.UNKNOWN) {
				protein.append(aminoAcid);
			}
		}
		if (protein != null) {
			logger.trace("Discarding ORF at " + start + " in frame " + (frame + 1) + " with no stop codon");
		}
	}

}
