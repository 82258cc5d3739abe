package org.beng183.sequences;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tabulates codon and amino acid usage over the non-overlapping triplets of a nucleotide sequence.
 * @author dmyersturnbull
 */
public class CodonUsageAnalyzer {

	private static final int N_RANKED = 5;

	private static final double UNIFORM_FREQUENCY = 1.0 / (4*4*4);

	private static final Logger logger = LogManager.getLogger(CodonUsageAnalyzer.class.getName());

	private final GeneticCode code;

	public CodonUsageAnalyzer() {
		this(SimpleGeneticCode.standard());
	}

	public CodonUsageAnalyzer(GeneticCode code) {
		this.code = code;
	}

	/**
	 * Counts codons from offset 0; a trailing partial codon is dropped.
	 * Codons the genetic code doesn't know are counted as codons but not as amino acids.
	 */
	public CodonUsageResult codonUsage(String sequence, SequenceKind kind) {

		String cleanSeq = SequenceNormalizer.clean(sequence);
		boolean isRna = SequenceNormalizer.isRna(cleanSeq, kind);
		if (isRna) cleanSeq = SequenceNormalizer.toDna(cleanSeq);

		Map<String,Integer> codons = new LinkedHashMap<>();
		Map<Character,Integer> aminoAcids = new LinkedHashMap<>();
		int nCodons = cleanSeq.length() / 3;
		for (int i = 0; i < nCodons; i++) {
			String codon = getCodon(cleanSeq, i);
			String displayCodon = isRna ? SequenceNormalizer.toRna(codon) : codon;
			Counts.increment(codons, displayCodon);
			char aminoAcid = code.getAminoAcid(codon);
			if (aminoAcid != GeneticCode.UNKNOWN) {
				Counts.increment(aminoAcids, aminoAcid);
			} else {
				logger.trace("Codon #" + i + " (" + codon + ") has no amino acid");
			}
		}

		// Collections.sort is stable, so ties keep their order of first occurrence
		List<Map.Entry<String,Integer>> ranked = new ArrayList<>(codons.entrySet());
		Collections.sort(ranked, Counts.<String>byCountDescending());
		List<String> mostFrequent = new ArrayList<>();
		for (int i = 0; i < Math.min(N_RANKED, ranked.size()); i++) {
			mostFrequent.add(ranked.get(i).getKey());
		}
		List<String> leastFrequent = new ArrayList<>();
		for (int i = Math.max(0, ranked.size() - N_RANKED); i < ranked.size(); i++) {
			leastFrequent.add(ranked.get(i).getKey());
		}

		double bias = 0;
		if (nCodons > 0) {
			DescriptiveStatistics deviations = new DescriptiveStatistics();
			for (int count : codons.values()) {
				deviations.addValue(Math.abs((double) count / nCodons - UNIFORM_FREQUENCY));
			}
			bias = deviations.getMean();
		}

		return new CodonUsageResult(codons, aminoAcids, nCodons, mostFrequent, leastFrequent, Decimals.round(bias, 3));
	}

	public CodonUsageResult codonUsage(NormalizedSequence sequence) {
		return codonUsage(sequence.getSymbols(), sequence.getKind());
	}

	/**
	 * Returns the {@code nRead}th codon’s 3-letter code.
	 */
	private static String getCodon(String geneticSequence, int nRead) {
		return geneticSequence.substring(nRead * 3, (nRead + 1) * 3);
	}

}
