package org.beng183.sequences;

import static org.junit.Assert.*;

import org.junit.Test;

public class SequenceAnalyzerTest {

	private static final double PRECISION = Math.pow(2, -16);

	private final SequenceAnalyzer analyzer = new SequenceAnalyzer();

	@Test
	public void testDna() throws AnalysisException {
		SequenceReport report = analyzer.analyze(">gene\nATGAAACCCGGGTTTTAA\n", SequenceKind.DNA);
		assertEquals("ATGAAACCCGGGTTTTAA", report.getSequence().getSymbols());
		assertEquals(18, report.getComposition().getLength());
		assertEquals(6, report.getCodonUsage().getTotalCodons());
		assertEquals(3, report.getTranslations().size());
		assertEquals("MKPGF*", report.getTranslations().get(0).getProtein());
		assertEquals(1, report.getOrfs().getTotalOrfs());
		assertNull(report.getProteinProperties());
		assertNull(report.getMutations());
	}

	@Test
	public void testRnaFromDnaLikeText() throws AnalysisException {
		SequenceReport report = analyzer.analyze("atg aaa tag", SequenceKind.RNA);
		assertEquals("AUGAAAUAG", report.getSequence().getSymbols());
		assertTrue(report.getCodonUsage().getCodons().containsKey("AUG"));
	}

	@Test
	public void testProtein() throws AnalysisException {
		SequenceReport report = analyzer.analyze(">p\nMKR\nDE*", SequenceKind.PROTEIN);
		assertNull(report.getComposition());
		assertNull(report.getTranslations());
		assertEquals(5, report.getProteinProperties().getLength()); // normalizing drops the stop
		assertEquals(7.0, report.getProteinProperties().getIsoelectricPoint(), PRECISION);
	}

	@Test
	public void testReference() throws AnalysisException {
		SequenceReport report = analyzer.analyze("ATGG", SequenceKind.DNA, ">ref\nATGC");
		MutationAnalysis mutations = report.getMutations();
		assertEquals(1, mutations.getTotalMutations());
		assertEquals("C", mutations.getMutations().get(0).getOriginal());
		assertEquals("G", mutations.getMutations().get(0).getMutated());
	}

	@Test
	public void testBlankReferenceIgnored() throws AnalysisException {
		assertNull(analyzer.analyze("ATGG", SequenceKind.DNA, "  \n").getMutations());
	}

	@Test(expected = AnalysisException.class)
	public void testInvalid() throws AnalysisException {
		analyzer.analyze("ATGNNN", SequenceKind.DNA);
	}

	@Test(expected = AnalysisException.class)
	public void testEmpty() throws AnalysisException {
		analyzer.analyze(">header only\n", SequenceKind.DNA);
	}

	@Test(expected = AnalysisException.class)
	public void testInvalidReference() throws AnalysisException {
		analyzer.analyze("ATGC", SequenceKind.DNA, "ATGX");
	}

}
