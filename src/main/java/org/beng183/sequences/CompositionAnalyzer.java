package org.beng183.sequences;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Counts bases and derives GC and AT content and skew.
 * @author dmyersturnbull
 */
public class CompositionAnalyzer {

	private static final Logger logger = LogManager.getLogger(CompositionAnalyzer.class.getName());

	/**
	 * Computes the composition of a nucleotide sequence.
	 * The sequence is treated as RNA if {@code kind} says so or if it contains any U, so mislabeled RNA still counts U.
	 * An empty sequence gives zero counts, contents and skews.
	 */
	public CompositionResult composition(String sequence, SequenceKind kind) {

		String cleanSeq = SequenceNormalizer.clean(sequence);
		int length = cleanSeq.length();
		boolean isRna = SequenceNormalizer.isRna(cleanSeq, kind);
		char thymine = isRna ? 'U' : 'T';

		int a = 0, t = 0, g = 0, c = 0;
		for (int i = 0; i < length; i++) {
			char base = cleanSeq.charAt(i);
			if (base == 'A') a++;
			else if (base == thymine) t++;
			else if (base == 'G') g++;
			else if (base == 'C') c++;
		}

		Map<Character,Integer> composition = new LinkedHashMap<>();
		composition.put('A', a);
		composition.put(thymine, t);
		composition.put('G', g);
		composition.put('C', c);

		if (a + t + g + c != length) {
			logger.debug((length - a - t - g - c) + " of " + length + " symbols are not " + (isRna ? "RNA" : "DNA") + " bases");
		}

		double gcContent = ratio(g + c, length) * 100;
		double atContent = ratio(a + t, length) * 100;
		double gcSkew = ratio(g - c, g + c);
		double atSkew = ratio(a - t, a + t);

		return new CompositionResult(composition, Decimals.round(gcContent, 2), Decimals.round(atContent, 2),
				Decimals.round(gcSkew, 3), Decimals.round(atSkew, 3), length);
	}

	public CompositionResult composition(NormalizedSequence sequence) {
		return composition(sequence.getSymbols(), sequence.getKind());
	}

	private static double ratio(int numerator, int denominator) {
		if (denominator == 0) return 0;
		return (double) numerator / denominator;
	}

}
