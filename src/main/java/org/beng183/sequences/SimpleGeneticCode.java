package org.beng183.sequences;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A simple {@link GeneticCode} that reads a table from the classpath (by default, from genetic_codes/) to determine translations.
 * The file lists a block of codons under each amino acid:
 * <pre>
 * ; comment
 * !M
 * ATG
 * </pre>
 * Instances are immutable once read.
 * @author dmyersturnbull
 */
public class SimpleGeneticCode implements GeneticCode {

	private static final String CODE_DIR = "genetic_codes/";
	private static final String CODE_FILENAME_EXTENSION = ".code";

	public static final String STANDARD = "standard";

	private static final Logger logger = LogManager.getLogger(SimpleGeneticCode.class.getName());

	private static volatile SimpleGeneticCode standard;

	private final Map<String,Character> map;

	/**
	 * Returns the standard code, reading it on first use.
	 */
	public static SimpleGeneticCode standard() {
		SimpleGeneticCode code = standard;
		if (code == null) {
			synchronized (SimpleGeneticCode.class) {
				code = standard;
				if (code == null) {
					code = createForName(STANDARD);
					standard = code;
				}
			}
		}
		return code;
	}

	public static SimpleGeneticCode createForName(String codeName) {
		String name = codeName.toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");
		String resource = CODE_DIR + name + CODE_FILENAME_EXTENSION;
		InputStream stream = SimpleGeneticCode.class.getClassLoader().getResourceAsStream(resource);
		if (stream == null) throw new IllegalArgumentException("No genetic code " + codeName + " (looked for " + resource + ")");
		return new SimpleGeneticCode(parse(stream, resource));
	}

	static Map<String, Character> parse(InputStream stream, String source) {

		Map<String,Character> map = new LinkedHashMap<>();
		int nAminoAcids = 0;
		try (BufferedReader br = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
			Character aminoAcid = null;
			String line = "";
			while ((line = br.readLine()) != null) {
				line = line.trim();
				if (line.isEmpty() || line.startsWith(";")) continue;
				if (line.startsWith("!")) {
					String letter = line.replace("!", "").trim();
					if (letter.length() != 1) throw new IllegalArgumentException("Couldn't parse amino acid line " + line + " in " + source);
					aminoAcid = letter.charAt(0);
					nAminoAcids++;
					logger.debug("Amino acid " + aminoAcid);
				} else {
					if (aminoAcid == null) throw new IllegalArgumentException("Codon " + line + " precedes any amino acid in " + source);
					String codon = line.toUpperCase(Locale.ROOT);
					if (codon.length() != 3) throw new IllegalArgumentException("Couldn't parse codon line " + line + " in " + source);
					Character previous = map.put(codon, aminoAcid);
					if (previous != null) throw new IllegalArgumentException("Codon " + codon + " is listed for both " + previous + " and " + aminoAcid + " in " + source);
				}
			}
		} catch (IOException e) {
			throw new IllegalArgumentException("Couldn't read genetic code " + source, e);
		}

		// sanity checks
		if (nAminoAcids != 21) {
			logger.warn(nAminoAcids + " amino acids were found in " + source + " (including stop codons, should be 21)");
		}
		if (map.size() < 4*4*4) {
			logger.warn("Only " + map.size() + " codons were found in " + source);
		}
		logger.info("Read " + map.size() + " codons for " + nAminoAcids + " amino acids from " + source);

		return map;
	}

	public SimpleGeneticCode(Map<String, Character> map) {
		this.map = Collections.unmodifiableMap(new LinkedHashMap<>(map));
	}

	@Override
	public char getAminoAcid(String codon) {
		Character aminoAcid = map.get(codon);
		return aminoAcid == null ? UNKNOWN : aminoAcid;
	}

	@Override
	public int size() {
		return map.size();
	}

}
