package org.beng183.sequences;

import static org.junit.Assert.*;

import java.util.Arrays;

import org.junit.Test;

public class CodonUsageAnalyzerTest {

	private static final double PRECISION = Math.pow(2, -16);

	private final CodonUsageAnalyzer analyzer = new CodonUsageAnalyzer();

	@Test
	public void testCounts() {
		CodonUsageResult result = analyzer.codonUsage("ATGATGAAA", SequenceKind.DNA);
		assertEquals(3, result.getTotalCodons());
		assertEquals(Integer.valueOf(2), result.getCodons().get("ATG"));
		assertEquals(Integer.valueOf(1), result.getCodons().get("AAA"));
		assertEquals(Integer.valueOf(2), result.getAminoAcids().get('M'));
		assertEquals(Integer.valueOf(1), result.getAminoAcids().get('K'));
		// mean of |2/3 - 1/64| and |1/3 - 1/64|
		assertEquals(0.484, result.getCodonBias(), PRECISION);
	}

	@Test
	public void testPartialCodonDropped() {
		CodonUsageResult result = analyzer.codonUsage("ATGAAAGC", SequenceKind.DNA);
		assertEquals(2, result.getTotalCodons());
		assertEquals(2, result.getCodons().size());
		assertFalse(result.getCodons().containsKey("GC"));
	}

	@Test
	public void testTotalIsFloorOfLengthOverThree() {
		String sequence = "ACGTTGCAACGGTAC";
		for (int length = 0; length <= sequence.length(); length++) {
			CodonUsageResult result = analyzer.codonUsage(sequence.substring(0, length), SequenceKind.DNA);
			assertEquals(length / 3, result.getTotalCodons());
		}
	}

	@Test
	public void testRnaKeysKeepU() {
		CodonUsageResult result = analyzer.codonUsage("AUGUUUUAA", SequenceKind.RNA);
		assertEquals(Arrays.asList("AUG", "UUU", "UAA"), Arrays.asList(result.getCodons().keySet().toArray()));
		assertEquals(Integer.valueOf(1), result.getAminoAcids().get('F'));
		assertEquals(Integer.valueOf(1), result.getAminoAcids().get('*'));
	}

	@Test
	public void testRankingKeepsFirstOccurrenceOnTies() {
		CodonUsageResult result = analyzer.codonUsage("TTTAAACCCAAAGGGCCCTTTACGTCA", SequenceKind.DNA);
		// TTT, AAA and CCC occur twice; GGG, ACG and TCA once
		assertEquals(Arrays.asList("TTT", "AAA", "CCC", "GGG", "ACG"), result.getMostFrequent());
		assertEquals(Arrays.asList("AAA", "CCC", "GGG", "ACG", "TCA"), result.getLeastFrequent());
	}

	@Test
	public void testFewerThanFiveCodons() {
		CodonUsageResult result = analyzer.codonUsage("GGGAAAAAA", SequenceKind.DNA);
		assertEquals(Arrays.asList("AAA", "GGG"), result.getMostFrequent());
		assertEquals(Arrays.asList("AAA", "GGG"), result.getLeastFrequent());
	}

	@Test
	public void testUnknownCodonCountedOnlyAsCodon() {
		CodonUsageResult result = analyzer.codonUsage("ATGNNN", SequenceKind.DNA);
		assertEquals(2, result.getTotalCodons());
		assertEquals(Integer.valueOf(1), result.getCodons().get("NNN"));
		assertEquals(1, result.getAminoAcids().size());
	}

	@Test
	public void testEmpty() {
		CodonUsageResult result = analyzer.codonUsage("", SequenceKind.DNA);
		assertEquals(0, result.getTotalCodons());
		assertTrue(result.getCodons().isEmpty());
		assertTrue(result.getMostFrequent().isEmpty());
		assertEquals(0, result.getCodonBias(), PRECISION);
	}

}
