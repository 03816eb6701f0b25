// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.cli.PosixParser;

import com.google.common.base.Charsets;
import com.google.common.base.Joiner;
import com.google.common.io.Files;

import edu.jhu.hlt.reinflect.util.LoggingSetup;
import edu.jhu.hlt.reinflect.util.ReinflectConfig;

/**
 * Decodes a file of source words with a trained pair n-gram model, printing
 * one prediction per line, or {@value #FAILURE} for an input with no decode.
 * With {@code --nbest} above 1 every line is
 * {@code input TAB rank TAB output TAB cost}.
 */
public class PairNGramPredictor {

    public static final String FAILURE = "<composition failure>";

    private final PrintStream out;

    public PairNGramPredictor(PrintStream out) {
        this.out = out;
    }

    public boolean execute(CommandLine cmd) throws IOException {
        if(!cmd.hasOption("words") || !cmd.hasOption("model") || !cmd.hasOption("symbols")) {
            System.err.println("--words, --model and --symbols are required.");
            return false;
        }
        TokenType tokens = TokenType.fromName(cmd.getOptionValue("token_type", "utf8"));
        int nbest = Integer.parseInt(cmd.getOptionValue("nbest", "1"));
        int threads = cmd.hasOption("threads") ? Integer.parseInt(cmd.getOptionValue("threads"))
            : ReinflectConfig.getInt(ReinflectConfig.DECODER_THREADS, Runtime.getRuntime().availableProcessors());

        SymbolTable symbols;
        try (Reader in = Files.newReader(new File(cmd.getOptionValue("symbols")), Charsets.UTF_8)) {
            symbols = SymbolTable.read(in);
        }
        PairNGramModel model;
        try (Reader in = Files.newReader(new File(cmd.getOptionValue("model")), Charsets.UTF_8)) {
            model = PairNGramModel.read(in);
        }
        int maxInsertions = ReinflectConfig.getInt(ReinflectConfig.DECODER_MAX_INSERTIONS, model.maxInsertionRun());
        Decoder decoder = new Decoder(model, symbols, maxInsertions, threads);

        List<List<String>> words = CorpusReader.readWords(new File(cmd.getOptionValue("words")), tokens);
        for(DecodeResult r : decoder.decodeAll(words, nbest)) {
            print(r, tokens, nbest);
        }
        out.flush();
        return true;
    }

    void print(DecodeResult r, TokenType tokens, int nbest) {
        if(nbest == 1) {
            out.println(r.isSuccess() ? tokens.join(r.best().output()) : FAILURE);
            return;
        }
        String input = Joiner.on(' ').join(r.source());
        if(!r.isSuccess()) {
            out.println(input + "\t1\t" + FAILURE + "\t" + Double.POSITIVE_INFINITY);
            return;
        }
        int rank = 1;
        for(ScoredOutput o : r.outputs()) {
            out.println(input + "\t" + rank++ + "\t" + tokens.join(o.output()) + "\t" + o.cost());
        }
    }

    static Options createOptions() {
		Options options = new Options();

        options.addOption("w", "words", true, "Path to words to decode (source[<TAB>features]).");
        options.addOption("m", "model", true, "Path to the pair n-gram model.");
        options.addOption("s", "symbols", true, "Path to the symbol table the model was trained with.");
        options.addOption("n", "nbest", true, "Number of distinct outputs per word (default: 1).");
        options.addOption("p", "threads", true, "Number of threads to use.");
        options.addOption("k", "token_type", true, "utf8 (characters) or space (space-separated symbols).");

        return options;
    }

    public static void main(String [] args) throws IOException {
        LoggingSetup.configure();

        final String usage = "java " + PairNGramPredictor.class.getName() + " [OPTIONS]";
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

		final PairNGramPredictor predictor = new PairNGramPredictor(System.out);
		final boolean success = predictor.execute(cmd);
		if(! success) {
			formatter.printHelp(usage, options, true);
			System.exit(-1);
		}
	}
}
