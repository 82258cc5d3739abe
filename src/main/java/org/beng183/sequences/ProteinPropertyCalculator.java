package org.beng183.sequences;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Calculates composition, molecular weight, hydropathy and an isoelectric point estimate for a protein.
 * <p>
 * The isoelectric point is <em>not</em> found by titrating pKa values. It is estimated as
 * <pre>
 * pI = 7 + 0.5 × (#R + #K + #H − #D − #E)
 * </pre>
 * and is unbounded for long proteins.
 * </p>
 * Symbols that are not one of the 20 standard residues (stops, {@code X}) are counted in the composition and length,
 * but contribute nothing to the weight or hydropathy.
 * @author dmyersturnbull
 */
public class ProteinPropertyCalculator {

	private static final double NEUTRAL_PH = 7.0;
	private static final double PH_PER_CHARGE = 0.5;

	public ProteinProperties calculate(String protein) {

		String cleanSeq = cleanProtein(protein);

		Map<Character,Integer> composition = new LinkedHashMap<>();
		double weight = 0;
		DescriptiveStatistics hydropathy = new DescriptiveStatistics();
		int charge = 0;
		for (int i = 0; i < cleanSeq.length(); i++) {
			char letter = cleanSeq.charAt(i);
			Counts.increment(composition, letter);
			AminoAcid aminoAcid = AminoAcid.forLetter(letter);
			if (aminoAcid == null) continue;
			weight += aminoAcid.getWeight();
			hydropathy.addValue(aminoAcid.getHydropathy());
			if (aminoAcid.isBasic()) charge++;
			else if (aminoAcid.isAcidic()) charge--;
		}

		double isoelectricPoint = NEUTRAL_PH + PH_PER_CHARGE * charge;
		double meanHydropathy = hydropathy.getN() > 0 ? hydropathy.getMean() : 0;

		return new ProteinProperties(cleanSeq.length(), Decimals.round(weight, 2), Decimals.round(isoelectricPoint, 2),
				Decimals.round(meanHydropathy, 2), composition);
	}

	/**
	 * Uppercases and removes whitespace and anything else that is neither a letter nor a stop.
	 */
	private static String cleanProtein(String protein) {
		StringBuilder sb = new StringBuilder(protein.length());
		for (int i = 0; i < protein.length(); i++) {
			char c = Character.toUpperCase(protein.charAt(i));
			if (c >= 'A' && c <= 'Z' || c == GeneticCode.STOP) sb.append(c);
		}
		return sb.toString();
	}

}
