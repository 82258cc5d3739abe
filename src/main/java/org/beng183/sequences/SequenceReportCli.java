package org.beng183.sequences;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Prints a plain-text {@link SequenceReport} for a sequence file, optionally against a reference file.
 * Files may be FASTA or bare sequence text.
 * @author dmyersturnbull
 */
public class SequenceReportCli {

	private static final Logger logger = LogManager.getLogger(SequenceReportCli.class.getName());

	private static final String NEWLINE = System.getProperty("line.separator");

	public static void main(String[] args) throws AnalysisException, LoadException {

		if (args.length < 2 || args.length > 3) {
			printUsage();
			return;
		}

		SequenceKind kind;
		try {
			kind = SequenceKind.forName(args[0]);
		} catch (IllegalArgumentException e) {
			logger.warn(e.getMessage());
			printUsage();
			return;
		}

		logger.info("Reading sequence from " + args[1]);
		String raw = read(new File(args[1]));
		String reference = null;
		if (args.length == 3) {
			logger.info("Reading reference from " + args[2]);
			reference = read(new File(args[2]));
		}

		logger.info("Initializing analyzer");
		SequenceAnalyzer analyzer = new SequenceAnalyzer();

		SequenceReport report = analyzer.analyze(raw, kind, reference);
		print(report, System.out);
	}

	private static void printUsage() {
		System.err.println("Usage: " + SequenceReportCli.class.getSimpleName() + " dna|rna|protein sequence-file [reference-file]");
	}

	/**
	 * Reads the whole of a file as text, keeping line breaks so that FASTA headers can still be recognized.
	 */
	static String read(File file) throws LoadException {
		StringBuilder sb = new StringBuilder();
		try (BufferedReader br = new BufferedReader(new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8))) {
			String line = "";
			while ((line = br.readLine()) != null) {
				sb.append(line).append('\n');
			}
		} catch (IOException e) {
			throw new LoadException("Couldn't read file " + file, e);
		}
		return sb.toString();
	}

	static void print(SequenceReport report, PrintStream out) {

		NormalizedSequence sequence = report.getSequence();
		printHeader("sequence", out);
		out.println(sequence.getKind().getName() + ", " + sequence.length() + " symbols");

		if (report.getComposition() != null) {
			CompositionResult composition = report.getComposition();
			printHeader("composition", out);
			out.println(composition.getComposition());
			out.println("GC content: " + format(composition.getGcContent()) + "%; GC skew: " + composition.getGcSkew());
			out.println("AT content: " + format(composition.getAtContent()) + "%; AT skew: " + composition.getAtSkew());
		}

		if (report.getCodonUsage() != null) {
			CodonUsageResult usage = report.getCodonUsage();
			printHeader("codons", out);
			out.println(usage.getTotalCodons() + " codons; bias " + usage.getCodonBias());
			out.println("most frequent: " + usage.getMostFrequent());
			out.println("least frequent: " + usage.getLeastFrequent());
			for (Map.Entry<String, Integer> entry : usage.getCodons().entrySet()) {
				out.println(entry.getKey() + "\t" + entry.getValue());
			}
		}

		if (report.getTranslations() != null) {
			printHeader("translation", out);
			for (TranslationResult translation : report.getTranslations()) {
				out.println("frame " + (translation.getFrame() + 1) + ": " + translation.getProtein());
				out.println("\tMW " + format(translation.getMolecularWeight()) + " Da; pI " + format(translation.getIsoelectricPoint())
						+ "; hydropathy " + format(translation.getHydropathy()));
			}
		}

		if (report.getOrfs() != null) {
			OrfSummary orfs = report.getOrfs();
			printHeader("orfs", out);
			out.println(orfs.getTotalOrfs() + " ORFs covering " + format(orfs.getCoverage()) + "%; by frame " + orfs.getFrameDistribution());
			for (OpenReadingFrame orf : orfs.getOrfs()) {
				out.println("frame " + orf.getFrame() + "\t" + orf.getStart() + "-" + orf.getEnd() + "\t" + orf.getProtein());
			}
		}

		if (report.getProteinProperties() != null) {
			ProteinProperties properties = report.getProteinProperties();
			printHeader("protein", out);
			out.println("MW " + format(properties.getMolecularWeight()) + " Da; pI " + format(properties.getIsoelectricPoint()) + "; hydropathy "
					+ format(properties.getHydropathy()));
			out.println(properties.getComposition());
		}

		if (report.getMutations() != null) {
			MutationAnalysis mutations = report.getMutations();
			printHeader("mutations", out);
			out.println(mutations.getTotalMutations() + " mutations; rate " + format(mutations.getMutationRate()) + "%");
			for (Mutation mutation : mutations.getMutations()) {
				out.println(mutation);
			}
		}
	}

	private static String format(double value) {
		return String.format("%1$.2f", value);
	}

	private static void printHeader(String name, PrintStream out) {
		out.println(repeat(NEWLINE, 1));
		out.println(repeat("-", 80));
		out.println(repeat("-", 40 - name.length()/2) + name + repeat("-", 40 - (name.length() + 1)/2));
		out.println(repeat("-", 80));
	}

	private static String repeat(String s, int x) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < x; i++) sb.append(s);
		return sb.toString();
	}

}
