package org.beng183.sequences;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

/**
 * A test for {@link GeneticCode}.
 * @author dmyersturnbull
 */
@RunWith(Parameterized.class)
public class GeneticCodeTest {

	private final GeneticCode code;
	private final Map<String,Character> valuesToTest;

	public GeneticCodeTest(GeneticCode code, Map<String,Character> valuesToTest) {
		this.code = code;
		this.valuesToTest = valuesToTest;
	}

	@Test
	public final void test() {
		for (Map.Entry<String,Character> entry : valuesToTest.entrySet()) {
			assertEquals("Wrong entry for " + entry.getKey(), entry.getValue().charValue(), code.getAminoAcid(entry.getKey()));
		}
	}

	@Test
	public final void testUnknown() {
		assertEquals(GeneticCode.UNKNOWN, code.getAminoAcid("NNN"));
		assertEquals(GeneticCode.UNKNOWN, code.getAminoAcid("AT"));
		assertEquals(GeneticCode.UNKNOWN, code.getAminoAcid("AUG")); // codes are keyed in the DNA alphabet
	}

	@Parameters
	public static Collection<Object[]> getInstances() {
		List<Object[]> list = new ArrayList<>();

		Map<String, Character> valuesToTest = new LinkedHashMap<>();
		valuesToTest.put("ATG", 'M');
		valuesToTest.put("TAA", '*');
		valuesToTest.put("TAG", '*');
		valuesToTest.put("TGA", '*');
		valuesToTest.put("TGG", 'W');
		valuesToTest.put("CTT", 'L');
		valuesToTest.put("TTA", 'L');
		valuesToTest.put("AGA", 'R');
		valuesToTest.put("AGT", 'S');
		valuesToTest.put("GGG", 'G');
		list.add(new Object[] {SimpleGeneticCode.standard(), valuesToTest});

		Map<String, Character> small = new LinkedHashMap<>();
		small.put("ATG", 'M');
		small.put("TAA", '*');
		list.add(new Object[] {new SimpleGeneticCode(small), small});

		return list;
	}
}
