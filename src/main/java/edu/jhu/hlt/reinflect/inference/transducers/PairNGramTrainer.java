// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.logging.Logger;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.cli.PosixParser;

import com.google.common.base.Charsets;
import com.google.common.io.Files;

import edu.jhu.hlt.reinflect.util.LoggingSetup;
import edu.jhu.hlt.reinflect.util.ReinflectConfig;

/**
 * Trains a pair n-gram model from a TSV of (source, target[, features])
 * examples: builds the symbol table, aligns with EM, estimates the model and
 * writes the symbol table, the model and optionally the alignments.
 * Values in the {@code config.filename} properties file serve as defaults
 * for the flags.
 */
public class PairNGramTrainer {

    private static final Logger log = Logger.getLogger(PairNGramTrainer.class.getName());

    public static final int DEFAULT_ORDER = 3;

    public boolean execute(CommandLine cmd) throws IOException {
        if(!cmd.hasOption("tsv") || !cmd.hasOption("symbols") || !cmd.hasOption("output")) {
            System.err.println("--tsv, --symbols and --output are required.");
            return false;
        }

        AlignerOptions opts = AlignerOptions.fromConfig();
        if(cmd.hasOption("seed")) opts.seed = Long.parseLong(cmd.getOptionValue("seed"));
        if(cmd.hasOption("random_starts")) opts.randomStarts = Integer.parseInt(cmd.getOptionValue("random_starts"));
        if(cmd.hasOption("max_iters")) opts.maxIterations = Integer.parseInt(cmd.getOptionValue("max_iters"));
        if(cmd.hasOption("delta")) opts.delta = Double.parseDouble(cmd.getOptionValue("delta"));
        if(cmd.hasOption("threads")) opts.threads = Integer.parseInt(cmd.getOptionValue("threads"));
        if(cmd.hasOption("max_source_length"))
            opts.maxSourceLength = Integer.parseInt(cmd.getOptionValue("max_source_length"));
        if(cmd.hasOption("max_target_length"))
            opts.maxTargetLength = Integer.parseInt(cmd.getOptionValue("max_target_length"));
        if(cmd.hasOption("input_epsilon")) opts.sourceEpsilon = Boolean.parseBoolean(cmd.getOptionValue("input_epsilon"));
        if(cmd.hasOption("output_epsilon")) opts.targetEpsilon = Boolean.parseBoolean(cmd.getOptionValue("output_epsilon"));
        log.info("Aligner options: " + opts);

        int order = cmd.hasOption("order") ? Integer.parseInt(cmd.getOptionValue("order"))
            : ReinflectConfig.getInt(ReinflectConfig.NGRAM_ORDER, DEFAULT_ORDER);
        double discount = cmd.hasOption("discount") ? Double.parseDouble(cmd.getOptionValue("discount"))
            : ReinflectConfig.getDouble(ReinflectConfig.NGRAM_DISCOUNT, Double.NaN);
        TokenType tokens = TokenType.fromName(cmd.getOptionValue("token_type", "utf8"));

        SymbolTable symbols = new SymbolTable();
        List<WordPair> pairs = CorpusReader.readPairs(new File(cmd.getOptionValue("tsv")), tokens, symbols);
        symbols.stopGrowth();

        PairAligner aligner = new PairAligner(symbols, opts);
        AlignmentModel alignmentModel = aligner.train(pairs);
        AlignedCorpus aligned = aligner.align(pairs, alignmentModel);

        PairNGramEstimator estimator = Double.isNaN(discount) ? new PairNGramEstimator() : new PairNGramEstimator(discount);
        PairNGramModel model = estimator.train(aligned, order);

        log.info("Writing symbol table to " + cmd.getOptionValue("symbols"));
        try (Writer out = Files.newWriter(new File(cmd.getOptionValue("symbols")), Charsets.UTF_8)) {
            symbols.write(out);
        }
        log.info("Writing model to " + cmd.getOptionValue("output"));
        try (Writer out = Files.newWriter(new File(cmd.getOptionValue("output")), Charsets.UTF_8)) {
            model.write(out);
        }
        if(cmd.hasOption("alignments")) {
            log.info("Writing alignments to " + cmd.getOptionValue("alignments"));
            try (Writer out = Files.newWriter(new File(cmd.getOptionValue("alignments")), Charsets.UTF_8)) {
                aligned.write(out);
            }
        }
        return true;
    }

    static Options createOptions() {
		Options options = new Options();

        options.addOption("t", "tsv", true, "Path to training data (source<TAB>target[<TAB>features]).");
        options.addOption("s", "symbols", true, "Path to write the symbol table.");
        options.addOption("o", "output", true, "Path to write the pair n-gram model.");
        options.addOption("a", "alignments", true, "Path to write the aligned training corpus.");
        options.addOption("n", "order", true, "N-gram order (default: " + DEFAULT_ORDER + ").");
        options.addOption("d", "discount", true, "Fixed discount in (0, 1) instead of estimating one per order.");
        options.addOption("r", "seed", true, "Random seed for the EM restarts.");
        options.addOption("b", "random_starts", true, "Number of EM random starts.");
        options.addOption("i", "max_iters", true, "Maximum EM iterations per start.");
        options.addOption("e", "delta", true, "EM stops when the log-likelihood gains less than this.");
        options.addOption("p", "threads", true, "Number of threads to use.");
        options.addOption("k", "token_type", true, "utf8 (characters) or space (space-separated symbols).");
        options.addOption(null, "max_source_length", true, "Longest source side of an aligned pair (1 or 2).");
        options.addOption(null, "max_target_length", true, "Longest target side of an aligned pair (1 or 2).");
        options.addOption(null, "input_epsilon", true, "Allow pairs with an empty source (true/false).");
        options.addOption(null, "output_epsilon", true, "Allow pairs with an empty target (true/false).");

        return options;
    }

    public static void main(String [] args) throws IOException {
        LoggingSetup.configure();

        final String usage = "java " + PairNGramTrainer.class.getName() + " [OPTIONS]";
		final CommandLineParser parser = new PosixParser();
		final Options options = createOptions();
		CommandLine cmd = null;
		final HelpFormatter formatter = new HelpFormatter();
		try {
			cmd = parser.parse(options, args);
		} catch (ParseException e1) {
            System.err.println(e1.getMessage());
			formatter.printHelp(usage, options, true);
			System.exit(-1);
		}

		final PairNGramTrainer trainer = new PairNGramTrainer();
		final boolean success = trainer.execute(cmd);
		if(! success) {
			formatter.printHelp(usage, options, true);
			System.exit(-1);
		}
	}
}
