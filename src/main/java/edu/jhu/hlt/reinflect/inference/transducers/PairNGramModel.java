// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Ints;

import edu.jhu.hlt.reinflect.util.LogMath;

/**
 * Smoothed n-gram model over aligned pairs, held as a weighted automaton in
 * backoff form.
 * <p>
 * States are the histories seen in training (at most order-1 pair labels).
 * A state has one arc per pair seen after its history, weighted by the cost
 * (negative natural log) of the full interpolated probability and leading to
 * the longest history that is itself a state. Every state except the empty
 * history has a failure arc to its one-shorter history, taken only for pairs
 * with no explicit arc; its weight is the cost of the interpolation mass. The
 * empty history has an explicit arc for every pair. Each state also carries
 * the cost of ending the sequence there.
 * <p>
 * Pair labels run from 1 to {@link #numPairs()} in {@link AlignedPair}
 * order; label 0 ({@link NGramContext#BOUNDARY}) marks the sequence start
 * inside histories.
 * <p>
 * States live in flat arrays indexed by state number, arcs in flat arrays
 * sliced per state and sorted by label. The model is immutable and may be
 * shared by any number of decoding threads.
 */
public final class PairNGramModel {

    static final String MAGIC = "pairngram";
    static final int VERSION = 1;

    private final int order;
    private final String symbolsFingerprint;
    private final int maxInsertionRun;

    private final ImmutableList<AlignedPair> pairs;
    private final ImmutableMap<AlignedPair, Integer> labels;

    private final NGramContext [] contexts;
    private final ImmutableMap<NGramContext, Integer> states;
    private final int startState;
    private final int [] backoffState;
    private final double [] backoffWeight;
    private final double [] finalWeight;

    private final int [] arcStart;  // arcs of state s are [arcStart[s], arcStart[s+1])
    private final int [] arcLabel;
    private final int [] arcDest;
    private final double [] arcWeight;

    /** Cost and destination of one (possibly backed-off) step. */
    public static final class Transition {
        public final double cost;
        public final int nextState;

        Transition(double cost, int nextState) {
            this.cost = cost;
            this.nextState = nextState;
        }
    }

    PairNGramModel(int order, String symbolsFingerprint, int maxInsertionRun, List<AlignedPair> pairs,
                   NGramContext [] contexts, int startState, int [] backoffState, double [] backoffWeight,
                   double [] finalWeight, int [] arcStart, int [] arcLabel, int [] arcDest, double [] arcWeight) {
        this.order = order;
        this.symbolsFingerprint = symbolsFingerprint;
        this.maxInsertionRun = maxInsertionRun;
        this.pairs = ImmutableList.copyOf(pairs);
        ImmutableMap.Builder<AlignedPair, Integer> lb = ImmutableMap.builder();
        for(int k=0; k<pairs.size(); k++) lb.put(pairs.get(k), k + 1);
        this.labels = lb.build();
        this.contexts = contexts;
        ImmutableMap.Builder<NGramContext, Integer> sb = ImmutableMap.builder();
        for(int s=0; s<contexts.length; s++) sb.put(contexts[s], s);
        this.states = sb.build();
        this.startState = startState;
        this.backoffState = backoffState;
        this.backoffWeight = backoffWeight;
        this.finalWeight = finalWeight;
        this.arcStart = arcStart;
        this.arcLabel = arcLabel;
        this.arcDest = arcDest;
        this.arcWeight = arcWeight;
    }

    public int order() { return order; }

    /** Fingerprint of the symbol table the pair sides refer to. */
    public String symbolsFingerprint() { return symbolsFingerprint; }

    /** Longest run of consecutive insertions in the training alignments. */
    public int maxInsertionRun() { return maxInsertionRun; }

    public int numPairs() { return pairs.size(); }

    public List<AlignedPair> pairs() { return pairs; }

    public AlignedPair pair(int label) { return pairs.get(label - 1); }

    /** Label of the pair, or -1 if the model has never seen it. */
    public int labelOf(AlignedPair pair) {
        Integer l = labels.get(pair);
        return l == null ? -1 : l;
    }

    public int numStates() { return contexts.length; }

    public int numArcs() { return arcLabel.length; }

    public int startState() { return startState; }

    public NGramContext context(int state) { return contexts[state]; }

    /** -1 for the empty history */
    public int backoffState(int state) { return backoffState[state]; }

    public double backoffWeight(int state) { return backoffWeight[state]; }

    /** The state for the longest suffix of {@code history} that the model has. */
    public int stateOf(NGramContext history) {
        NGramContext c = history;
        while(c.length() >= order) c = c.backoff();
        Integer s = states.get(c);
        while(s == null) {
            c = c.backoff();
            s = states.get(c);
        }
        return s;
    }

    private int findArc(int state, int label) {
        int i = Arrays.binarySearch(arcLabel, arcStart[state], arcStart[state + 1], label);
        return i < 0 ? -1 : i;
    }

    /**
     * Follows {@code label} out of {@code state}, backing off as needed.
     * Returns null for a label outside the pair alphabet.
     */
    public Transition transition(int state, int label) {
        if(label < 1 || label > pairs.size()) return null;
        double cost = 0.0;
        int s = state;
        int a = findArc(s, label);
        while(a < 0) {
            cost += backoffWeight[s];
            s = backoffState[s];
            if(s < 0) return null;
            a = findArc(s, label);
        }
        return new Transition(cost + arcWeight[a], arcDest[a]);
    }

    /** Cost of {@code label} after {@code state}; infinite for an unknown label. */
    public double score(int state, int label) {
        Transition t = transition(state, label);
        return t == null ? Double.POSITIVE_INFINITY : t.cost;
    }

    public double score(NGramContext context, AlignedPair pair) {
        int label = labelOf(pair);
        return label < 0 ? Double.POSITIVE_INFINITY : score(stateOf(context), label);
    }

    /** Cost of ending the sequence in {@code state}. */
    public double continuationWeight(int state) {
        return finalWeight[state];
    }

    public double continuationWeight(NGramContext context) {
        return finalWeight[stateOf(context)];
    }

    /** Probability of every next pair plus the end of sequence; 1 by construction. */
    public double totalProbability(int state) {
        double sum = LogMath.probability(finalWeight[state]);
        for(int label=1; label<=pairs.size(); label++) {
            sum += LogMath.probability(score(state, label));
        }
        return sum;
    }

    // ---------------- persistence ----------------

    public void write(Writer out) throws IOException {
        out.write(MAGIC + "\t" + VERSION + "\n");
        out.write("order\t" + order + "\n");
        out.write("symbols\t" + symbolsFingerprint + "\n");
        out.write("insertion_run\t" + maxInsertionRun + "\n");
        out.write("pairs\t" + pairs.size() + "\n");
        for(int k=0; k<pairs.size(); k++) {
            AlignedPair p = pairs.get(k);
            out.write((k + 1) + "\t" + AlignedPair.encodeSide(p.source()) + "\t" + AlignedPair.encodeSide(p.target()) + "\n");
        }
        out.write("states\t" + contexts.length + "\n");
        out.write("start\t" + startState + "\n");
        for(int s=0; s<contexts.length; s++) {
            int narcs = arcStart[s + 1] - arcStart[s];
            String ctx = contexts[s].length() == 0 ? "-" : Joiner.on(' ').join(Ints.asList(contexts[s].labels()));
            out.write("state\t" + s + "\t" + ctx + "\t" + backoffState[s] + "\t" + Double.toString(backoffWeight[s])
                      + "\t" + Double.toString(finalWeight[s]) + "\t" + narcs + "\n");
            for(int a=arcStart[s]; a<arcStart[s + 1]; a++) {
                out.write(arcLabel[a] + "\t" + arcDest[a] + "\t" + Double.toString(arcWeight[a]) + "\n");
            }
        }
        out.flush();
    }

    public static PairNGramModel read(Reader in) throws IOException {
        LineReader r = new LineReader(new BufferedReader(in));
        List<String> head = r.fields(2);
        if(!head.get(0).equals(MAGIC) || Integer.parseInt(head.get(1)) != VERSION)
            throw r.malformed("not a version " + VERSION + " pair n-gram model");
        int order = r.intField("order");
        String fingerprint = r.keyed("symbols");
        int insertionRun = r.intField("insertion_run");

        int npairs = r.intField("pairs");
        AlignedPair [] pairs = new AlignedPair[npairs];
        for(int k=0; k<npairs; k++) {
            List<String> f = r.fields(3);
            if(r.parseInt(f.get(0)) != k + 1) throw r.malformed("pair labels must be consecutive");
            try {
                pairs[k] = new AlignedPair(AlignedPair.decodeSide(f.get(1)), AlignedPair.decodeSide(f.get(2)));
            } catch(IllegalArgumentException e) {
                throw r.malformed("bad pair: " + e.getMessage());
            }
        }

        int nstates = r.intField("states");
        int start = r.intField("start");
        NGramContext [] contexts = new NGramContext[nstates];
        int [] backoffState = new int[nstates];
        double [] backoffWeight = new double[nstates];
        double [] finalWeight = new double[nstates];
        int [] arcStart = new int[nstates + 1];
        List<int []> labels = new ArrayList<int []>();
        List<int []> dests = new ArrayList<int []>();
        List<double []> weights = new ArrayList<double []>();
        int total = 0;
        for(int s=0; s<nstates; s++) {
            List<String> f = r.fields(7);
            if(!f.get(0).equals("state") || r.parseInt(f.get(1)) != s) throw r.malformed("expected state " + s);
            if(f.get(2).equals("-")) {
                contexts[s] = NGramContext.EMPTY;
            } else {
                List<String> parts = Splitter.on(' ').splitToList(f.get(2));
                int [] ctx = new int[parts.size()];
                for(int i=0; i<ctx.length; i++) ctx[i] = r.parseInt(parts.get(i));
                contexts[s] = new NGramContext(ctx);
            }
            backoffState[s] = r.parseInt(f.get(3));
            backoffWeight[s] = r.parseDouble(f.get(4));
            finalWeight[s] = r.parseDouble(f.get(5));
            int narcs = r.parseInt(f.get(6));
            int [] l = new int[narcs];
            int [] d = new int[narcs];
            double [] w = new double[narcs];
            for(int a=0; a<narcs; a++) {
                List<String> af = r.fields(3);
                l[a] = r.parseInt(af.get(0));
                d[a] = r.parseInt(af.get(1));
                w[a] = r.parseDouble(af.get(2));
                if(l[a] < 1 || l[a] > npairs || d[a] < 0 || d[a] >= nstates) throw r.malformed("arc out of range");
                if(a > 0 && l[a] <= l[a - 1]) throw r.malformed("arcs must be sorted by label");
            }
            labels.add(l);
            dests.add(d);
            weights.add(w);
            arcStart[s] = total;
            total += narcs;
        }
        arcStart[nstates] = total;
        int [] arcLabel = new int[total];
        int [] arcDest = new int[total];
        double [] arcWeight = new double[total];
        for(int s=0; s<nstates; s++) {
            System.arraycopy(labels.get(s), 0, arcLabel, arcStart[s], labels.get(s).length);
            System.arraycopy(dests.get(s), 0, arcDest, arcStart[s], dests.get(s).length);
            System.arraycopy(weights.get(s), 0, arcWeight, arcStart[s], weights.get(s).length);
        }
        if(start < 0 || start >= nstates) throw r.malformed("start state out of range");
        Set<NGramContext> seen = new HashSet<NGramContext>();
        for(int s=0; s<nstates; s++) {
            if(!seen.add(contexts[s])) throw r.malformed("duplicate context for state " + s);
            int b = backoffState[s];
            if(contexts[s].length() == 0) {
                if(b != -1) throw r.malformed("state " + s + " has the empty context and must not back off");
            } else if(b < 0 || b >= nstates || contexts[b].length() >= contexts[s].length()) {
                throw r.malformed("state " + s + " backs off to invalid state " + b);
            }
        }
        return new PairNGramModel(order, fingerprint, insertionRun, Arrays.asList(pairs), contexts, start,
                                  backoffState, backoffWeight, finalWeight, arcStart, arcLabel, arcDest, arcWeight);
    }

    /** Tab-separated line reader that reports the line number on errors. */
    private static final class LineReader {
        private final BufferedReader in;
        private int lineno = 0;

        LineReader(BufferedReader in) { this.in = in; }

        List<String> fields(int expected) throws IOException {
            String line = in.readLine();
            lineno++;
            if(line == null) throw malformed("unexpected end of model");
            List<String> f = Splitter.on('\t').splitToList(line);
            if(f.size() != expected) throw malformed("expected " + expected + " fields, found " + f.size());
            return f;
        }

        String keyed(String key) throws IOException {
            List<String> f = fields(2);
            if(!f.get(0).equals(key)) throw malformed("expected '" + key + "'");
            return f.get(1);
        }

        int intField(String key) throws IOException {
            return parseInt(keyed(key));
        }

        int parseInt(String s) {
            try {
                return Integer.parseInt(s);
            } catch(NumberFormatException e) {
                throw malformed("bad integer '" + s + "'");
            }
        }

        double parseDouble(String s) {
            try {
                return Double.parseDouble(s);
            } catch(NumberFormatException e) {
                throw malformed("bad number '" + s + "'");
            }
        }

        DataException malformed(String message) {
            return new DataException(DataException.Reason.MALFORMED_INPUT, "model line " + lineno + ": " + message);
        }
    }

    @Override
    public String toString() {
        return "PairNGramModel(order=" + order + ", " + pairs.size() + " pairs, " + contexts.length + " states, "
            + arcLabel.length + " arcs)";
    }
}
