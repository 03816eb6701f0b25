// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Joint distribution over candidate aligned pairs, as left by EM. Candidates
 * are held in {@link AlignedPair} order, so a candidate's index doubles as its
 * tie-break rank. Frozen once built.
 */
public final class AlignmentModel {

    private final ImmutableList<AlignedPair> pairs;
    private final ImmutableMap<AlignedPair, Integer> index;
    private final double [] probs;
    private final double [] logProbs;
    private final double [] history;

    AlignmentModel(List<AlignedPair> pairs, double [] probs, double [] history) {
        assert pairs.size() == probs.length;
        this.pairs = ImmutableList.copyOf(pairs);
        ImmutableMap.Builder<AlignedPair, Integer> b = ImmutableMap.builder();
        for(int k=0; k<pairs.size(); k++) {
            b.put(pairs.get(k), k);
        }
        this.index = b.build();
        this.probs = probs.clone();
        this.logProbs = new double[probs.length];
        for(int k=0; k<probs.length; k++) {
            logProbs[k] = Math.log(probs[k]);
        }
        this.history = history.clone();
    }

    public int size() { return pairs.size(); }

    public AlignedPair pair(int k) { return pairs.get(k); }

    public List<AlignedPair> pairs() { return pairs; }

    /** Index of the candidate, or -1 if it is not one. */
    public int indexOf(AlignedPair pair) {
        Integer k = index.get(pair);
        return k == null ? -1 : k;
    }

    public double probability(int k) { return probs[k]; }

    public double probability(AlignedPair pair) {
        int k = indexOf(pair);
        return k < 0 ? 0.0 : probs[k];
    }

    public double logProbability(int k) { return logProbs[k]; }

    public double totalProbability() {
        double sum = 0;
        for(double p : probs) sum += p;
        return sum;
    }

    /** Corpus log-likelihood under this model. */
    public double logLikelihood() {
        return history[history.length - 1];
    }

    /** Corpus log-likelihood before each M-step of the selected run, ending with this model's. */
    public double [] likelihoodHistory() { return history.clone(); }

    public int iterations() { return history.length - 1; }

    /** One "source:target TAB probability" line per candidate, in candidate order. */
    public void write(Writer out, SymbolTable symbols) throws IOException {
        for(int k=0; k<pairs.size(); k++) {
            out.write(pairs.get(k).format(symbols));
            out.write('\t');
            out.write(Double.toString(probs[k]));
            out.write('\n');
        }
        out.flush();
    }
}
