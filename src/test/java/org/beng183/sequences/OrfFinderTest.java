package org.beng183.sequences;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class OrfFinderTest {

	private static final double PRECISION = Math.pow(2, -16);

	private final OrfFinder finder = new OrfFinder();

	@Test
	public void testShortOrfExcluded() {
		// MKG then TAA: only 3 residues
		assertTrue(finder.findOrfs("ATGAAAGGGTAATAG", SequenceKind.DNA).isEmpty());
	}

	@Test
	public void testMinimumLength() {
		List<OpenReadingFrame> orfs = finder.findOrfs("ATGAAACCCGGGTTTTAA", SequenceKind.DNA);
		assertEquals(1, orfs.size());
		assertEquals(new OpenReadingFrame(0, 17, 1, "MKPGF"), orfs.get(0));
	}

	@Test
	public void testRna() {
		List<OpenReadingFrame> orfs = finder.findOrfs("AUGAAACCCGGGUUUUAA", SequenceKind.RNA);
		assertEquals(1, orfs.size());
		assertEquals("MKPGF", orfs.get(0).getProtein());
	}

	@Test
	public void testLongestFirst() {
		List<OpenReadingFrame> orfs = finder.findOrfs("ATGAAACCCGGGTTTTAAATGAAACCCGGGTTTCCCTAG", SequenceKind.DNA);
		assertEquals(2, orfs.size());
		assertEquals(new OpenReadingFrame(18, 38, 1, "MKPGFP"), orfs.get(0));
		assertEquals(new OpenReadingFrame(0, 17, 1, "MKPGF"), orfs.get(1));
	}

	@Test
	public void testTiesKeepFrameOrder() {
		// equal lengths: the frame 1 ORF comes first even though the frame 2 ORF starts earlier
		List<OpenReadingFrame> orfs = finder.findOrfs("CATGAAACCCGGGTTTTAACCATGAAACCCGGGTTTTAA", SequenceKind.DNA);
		assertEquals(2, orfs.size());
		assertEquals(new OpenReadingFrame(21, 38, 1, "MKPGF"), orfs.get(0));
		assertEquals(new OpenReadingFrame(1, 18, 2, "MKPGF"), orfs.get(1));
	}

	@Test
	public void testInnerStartIsAResidue() {
		List<OpenReadingFrame> orfs = finder.findOrfs("ATGAAACCCATGGGGTTTTGA", SequenceKind.DNA);
		assertEquals(1, orfs.size());
		assertEquals("MKPMGF", orfs.get(0).getProtein());
		assertEquals(20, orfs.get(0).getEnd());
	}

	@Test
	public void testUnterminatedDiscarded() {
		assertTrue(finder.findOrfs("ATGAAACCCGGGTTTCCC", SequenceKind.DNA).isEmpty());
	}

	@Test
	public void testEveryOrfEndsAtAStop() {
		String sequence = "CCATGGCTAAAGGTGAACTGTAGATGCCCATGAAATTTGGGCCCAAATGATTATGCATGCCCGGGAAATTTAA";
		GeneticCode code = SimpleGeneticCode.standard();
		for (OpenReadingFrame orf : finder.findOrfs(sequence, SequenceKind.DNA)) {
			assertTrue(orf.getProteinLength() >= OrfFinder.MIN_PROTEIN_LENGTH);
			assertEquals(GeneticCode.STOP, code.getAminoAcid(sequence.substring(orf.getEnd() - 2, orf.getEnd() + 1)));
			assertEquals("ATG", sequence.substring(orf.getStart(), orf.getStart() + 3));
			assertEquals(orf.getFrame() - 1, orf.getStart() % 3);
			assertEquals(-1, orf.getProtein().indexOf(GeneticCode.STOP));
		}
	}

	@Test
	public void testEmptyAndNull() {
		assertTrue(finder.findOrfs("", SequenceKind.DNA).isEmpty());
		assertTrue(finder.findOrfs((String) null, SequenceKind.DNA).isEmpty());
	}

	@Test
	public void testSummary() {
		OrfSummary summary = finder.summarize("ATGAAACCCGGGTTTTAAATGAAACCCGGGTTTCCCTAG", SequenceKind.DNA);
		assertEquals(2, summary.getTotalOrfs());
		assertEquals(39, summary.getSequenceLength());
		assertEquals("MKPGFP", summary.getLongest().getProtein());
		assertEquals(94.9, summary.getCoverage(), PRECISION); // (17 + 20) / 39
		assertEquals(1, summary.getFrameDistribution().size());
		assertEquals(Integer.valueOf(2), summary.getFrameDistribution().get(1));
	}

	@Test
	public void testFrameDistributionInFrameOrder() {
		// the longest ORF is in frame 2, but frame 1 is still listed first
		OrfSummary summary = finder.summarize("CATGAAACCCGGGTTTCCCTAACCATGAAACCCGGGTTTTAA", SequenceKind.DNA);
		assertEquals(2, summary.getLongest().getFrame());
		assertEquals(Arrays.asList(1, 2), Arrays.asList(summary.getFrameDistribution().keySet().toArray()));
		assertEquals(88.1, summary.getCoverage(), PRECISION); // (20 + 17) / 42
	}

	@Test
	public void testEmptySummary() {
		OrfSummary summary = finder.summarize("", SequenceKind.DNA);
		assertEquals(0, summary.getTotalOrfs());
		assertNull(summary.getLongest());
		assertEquals(0, summary.getCoverage(), PRECISION);
	}

}
