// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

import java.io.IOException;
import java.io.Writer;
import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The best segmentation of every alignable training pair. Pairs that admitted
 * no segmentation are left out and counted in {@link #failures()}.
 */
public final class AlignedCorpus implements Iterable<List<AlignedPair>> {

    private final SymbolTable symbols;
    private final ImmutableList<ImmutableList<AlignedPair>> alignments;
    private final int [] examples;
    private final int failures;

    AlignedCorpus(SymbolTable symbols, List<ImmutableList<AlignedPair>> alignments, int [] examples, int failures) {
        this.symbols = symbols;
        this.alignments = ImmutableList.copyOf(alignments);
        this.examples = examples.clone();
        this.failures = failures;
    }

    /** Builds a corpus directly from segmentations, e.g. ones aligned elsewhere. */
    public static AlignedCorpus of(SymbolTable symbols, List<? extends List<AlignedPair>> alignments) {
        ImmutableList.Builder<ImmutableList<AlignedPair>> b = ImmutableList.builder();
        int [] examples = new int[alignments.size()];
        for(int i=0; i<alignments.size(); i++) {
            b.add(ImmutableList.copyOf(alignments.get(i)));
            examples[i] = i;
        }
        return new AlignedCorpus(symbols, b.build(), examples, 0);
    }

    public int size() { return alignments.size(); }

    public List<AlignedPair> get(int i) { return alignments.get(i); }

    /** Position in the training corpus of the i-th aligned example. */
    public int exampleIndex(int i) { return examples[i]; }

    public int failures() { return failures; }

    public SymbolTable symbols() { return symbols; }

    @Override
    public Iterator<List<AlignedPair>> iterator() {
        return ImmutableList.<List<AlignedPair>>copyOf(alignments).iterator();
    }

    /** One example per line, pairs as "source:target" separated by spaces. */
    public void write(Writer out) throws IOException {
        for(List<AlignedPair> alignment : alignments) {
            for(int k=0; k<alignment.size(); k++) {
                if(k > 0) out.write(' ');
                out.write(alignment.get(k).format(symbols));
            }
            out.write('\n');
        }
        out.flush();
    }
}
