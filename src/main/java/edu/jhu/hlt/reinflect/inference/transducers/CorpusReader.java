// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import com.google.common.base.Charsets;
import com.google.common.base.Splitter;
import com.google.common.io.Files;

/**
 * Reads tab-separated training and test files.
 * <p>
 * A training line is {@code source TAB target [TAB features]}; a test line is
 * {@code source [TAB features]}. Features are a {@code ;}-separated tag bundle
 * such as {@code V;PST}; each tag becomes one source symbol {@code [V]},
 * {@code [PST]}, placed before the source symbols. Blank lines are skipped.
 */
public class CorpusReader {

    private static final Logger log = Logger.getLogger(CorpusReader.class.getName());

    private static final Splitter TAB = Splitter.on('\t');
    private static final Splitter FEATURES = Splitter.on(';').trimResults().omitEmptyStrings();

    private CorpusReader() {}

    /** Reads training pairs, interning their symbols into {@code symbols}. */
    public static List<WordPair> readPairs(File file, TokenType tokens, SymbolTable symbols) throws IOException {
        List<String> lines = Files.readLines(file, Charsets.UTF_8);
        List<WordPair> pairs = new ArrayList<WordPair>();
        for(int i=0; i<lines.size(); i++) {
            String line = lines.get(i);
            if(line.trim().isEmpty()) continue;
            List<String> fields = TAB.splitToList(line);
            if(fields.size() < 2 || fields.size() > 3)
                throw malformed(file, i, "expected source<TAB>target[<TAB>features]");
            List<String> source = source(fields.get(0), fields.size() == 3 ? fields.get(2) : null, tokens);
            List<String> target = tokens.tokenize(fields.get(1));
            pairs.add(WordPair.of(symbols, source, target));
        }
        log.info("Read " + pairs.size() + " pairs from " + file.getPath());
        return pairs;
    }

    /** Reads source words for decoding; symbols are not interned. */
    public static List<List<String>> readWords(File file, TokenType tokens) throws IOException {
        List<String> lines = Files.readLines(file, Charsets.UTF_8);
        List<List<String>> words = new ArrayList<List<String>>();
        for(int i=0; i<lines.size(); i++) {
            String line = lines.get(i);
            if(line.trim().isEmpty()) continue;
            List<String> fields = TAB.splitToList(line);
            if(fields.size() > 2)
                throw malformed(file, i, "expected source[<TAB>features]");
            words.add(source(fields.get(0), fields.size() == 2 ? fields.get(1) : null, tokens));
        }
        log.info("Read " + words.size() + " words from " + file.getPath());
        return words;
    }

    /** Tag symbols followed by the tokenized word. */
    public static List<String> source(String word, String features, TokenType tokens) {
        List<String> res = new ArrayList<String>();
        if(features != null) {
            for(String tag : FEATURES.split(features)) res.add("[" + tag + "]");
        }
        res.addAll(tokens.tokenize(word));
        return res;
    }

    private static DataException malformed(File file, int lineIndex, String message) {
        return new DataException(DataException.Reason.MALFORMED_INPUT,
                                 file.getPath() + ":" + (lineIndex + 1) + ": " + message);
    }
}
