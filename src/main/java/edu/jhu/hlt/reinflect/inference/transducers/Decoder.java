// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.primitives.Ints;

/**
 * Finds the cheapest output sequences for a source sequence under a
 * {@link PairNGramModel}.
 * <p>
 * For each input a {@link Lattice} of every segmentation into the model's
 * pairs is built, then searched jointly with the model state: a hypothesis
 * sits at a (lattice node, model state) cell, and cells are expanded in
 * lattice-node order, which is topological. Each cell keeps its best
 * {@code beam} hypotheses ordered by cost; among equal costs the one reached
 * first (lower lattice node, lower model state, lower pair label) ranks
 * first. Complete paths add the end-of-sequence cost of their final state.
 * <p>
 * Different paths may spell the same output. {@link #decode(List, int)}
 * keeps the cheapest path per output and widens the beam until it has k
 * distinct outputs or the search is exhaustive.
 * <p>
 * A decoder is immutable and may be used from several threads.
 */
public class Decoder {

    private static final Logger log = Logger.getLogger(Decoder.class.getName());

    /** widest beam tried when merging equal outputs, per requested output */
    static final int MAX_BEAM_FACTOR = 256;

    private final PairNGramModel model;
    private final SymbolTable symbols;
    private final int maxRun;
    private final int threads;

    private final ListMultimap<List<Integer>, Integer> bySource = ArrayListMultimap.create();
    private final int [] insertions;
    private final int maxSource;

    public Decoder(PairNGramModel model, SymbolTable symbols) {
        this(model, symbols, model.maxInsertionRun(), Runtime.getRuntime().availableProcessors());
    }

    /**
     * @param maxInsertions most consecutive insertion pairs at one source position
     * @param threads workers for {@link #decodeAll}
     */
    public Decoder(PairNGramModel model, SymbolTable symbols, int maxInsertions, int threads) {
        if(!model.symbolsFingerprint().equals(symbols.fingerprint()))
            throw new DataException(DataException.Reason.SYMBOL_TABLE_MISMATCH,
                                    "model was trained with a different symbol table");
        if(maxInsertions < 0)
            throw new ModelException(ModelException.Reason.INVALID_OPTION,
                                     "maxInsertions must be non-negative, got " + maxInsertions);
        if(threads < 1)
            throw new ModelException(ModelException.Reason.INVALID_OPTION, "threads must be positive, got " + threads);
        this.model = model;
        this.symbols = symbols;
        this.threads = threads;
        List<Integer> ins = new ArrayList<Integer>();
        int longest = 0;
        for(int label=1; label<=model.numPairs(); label++) {
            AlignedPair p = model.pair(label);
            if(p.isInsertion()) {
                ins.add(label);
            } else {
                bySource.put(Ints.asList(p.source()), label);
                longest = Math.max(longest, p.sourceLength());
            }
        }
        this.insertions = Ints.toArray(ins);
        this.maxSource = longest;
        this.maxRun = insertions.length == 0 ? 0 : maxInsertions;
    }

    public PairNGramModel getModel() { return model; }

    /** Single best output. */
    public List<String> decode(List<String> source) throws DecodeFailureException {
        return decode(source, 1).get(0).output();
    }

    /** Up to {@code k} distinct outputs, cheapest first. */
    public List<ScoredOutput> decode(List<String> source, int k) throws DecodeFailureException {
        if(k < 1) throw new ModelException(ModelException.Reason.INVALID_OPTION, "k must be positive, got " + k);
        int [] x = new int[source.size()];
        for(int i=0; i<x.length; i++) {
            x[i] = symbols.indexOf(source.get(i));
            if(x[i] <= SymbolTable.EPSILON_ID)
                throw new DecodeFailureException(DecodeFailureException.Reason.UNKNOWN_SYMBOL,
                                                 "unknown symbol '" + source.get(i) + "' in " + source);
        }
        Lattice lat = Lattice.build(x, bySource, insertions, maxSource, maxRun);
        if(!lat.hasPath())
            throw new DecodeFailureException(DecodeFailureException.Reason.NO_PATH,
                                             "no pair sequence covers " + source);
        int maxBeam = k * MAX_BEAM_FACTOR;
        for(int beam=k; ; beam*=2) {
            Search s = new Search(lat, beam);
            List<ScoredOutput> outputs = distinct(s.complete(), k);
            if(outputs.size() >= k || !s.truncated || beam >= maxBeam) {
                if(outputs.isEmpty())
                    throw new DecodeFailureException(DecodeFailureException.Reason.NO_PATH,
                                                     "no path through the model for " + source);
                return outputs;
            }
            log.fine("only " + outputs.size() + " distinct outputs with beam " + beam + "; widening");
        }
    }

    /**
     * Decodes every source on a worker pool. Results come back in input
     * order; a failed input yields a failed result and does not stop the rest.
     */
    public List<DecodeResult> decodeAll(List<List<String>> sources, final int k) {
        List<Callable<DecodeResult>> tasks = new ArrayList<Callable<DecodeResult>>(sources.size());
        for(final List<String> source : sources) {
            tasks.add(new Callable<DecodeResult>() {
                @Override
                public DecodeResult call() {
                    try {
                        return DecodeResult.success(source, decode(source, k));
                    } catch(DecodeFailureException e) {
                        log.fine("decode failure: " + e.getMessage());
                        return DecodeResult.failure(source, e);
                    }
                }
            });
        }
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<DecodeResult> results = PairAligner.invokeAll(pool, tasks);
            int failures = 0;
            for(DecodeResult r : results) if(!r.isSuccess()) failures++;
            log.info("Decoded " + results.size() + " inputs, " + failures + " failures");
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private List<ScoredOutput> distinct(List<Hyp> complete, int k) {
        List<ScoredOutput> res = new ArrayList<ScoredOutput>();
        Set<List<String>> seen = new HashSet<List<String>>();
        for(Hyp h : complete) {
            List<AlignedPair> path = new ArrayList<AlignedPair>();
            for(Hyp c=h; c.prev!=null; c=c.prev) path.add(model.pair(c.label));
            Collections.reverse(path);
            List<String> output = new ArrayList<String>();
            for(AlignedPair p : path) output.addAll(symbols.seq2str(p.target()));
            if(seen.add(output)) {
                res.add(new ScoredOutput(output, path, h.cost));
                if(res.size() == k) break;
            }
        }
        return res;
    }

    /** A partial path: its cost and the pair that ended it. */
    static final class Hyp {
        final double cost;
        final Hyp prev;
        final int label;

        Hyp(double cost, Hyp prev, int label) {
            this.cost = cost;
            this.prev = prev;
            this.label = label;
        }
    }

    private static final Comparator<Hyp> BY_COST = new Comparator<Hyp>() {
        @Override
        public int compare(Hyp a, Hyp b) {
            return Double.compare(a.cost, b.cost);
        }
    };

    /** One beam search over the lattice composed with the model. */
    private final class Search {
        final Lattice lat;
        final int beam;
        boolean truncated = false;
        // cells.get(v): model state -> hypotheses, cheapest first
        final List<TreeMap<Integer, List<Hyp>>> cells;

        Search(Lattice lat, int beam) {
            this.lat = lat;
            this.beam = beam;
            this.cells = new ArrayList<TreeMap<Integer, List<Hyp>>>(lat.numNodes);
            for(int v=0; v<lat.numNodes; v++) cells.add(null);
            cell(0, model.startState()).add(new Hyp(0.0, null, 0));
            for(int v=0; v<lat.numNodes; v++) {
                TreeMap<Integer, List<Hyp>> here = cells.get(v);
                if(here == null) continue;
                for(Map.Entry<Integer, List<Hyp>> e : here.entrySet()) {
                    int state = e.getKey();
                    for(int a=lat.edgeStart[v]; a<lat.edgeStart[v + 1]; a++) {
                        PairNGramModel.Transition t = model.transition(state, lat.edgeLabel[a]);
                        if(t == null || Double.isInfinite(t.cost)) continue;
                        List<Hyp> dest = cell(lat.edgeDest[a], t.nextState);
                        for(Hyp h : e.getValue()) {
                            if(!offer(dest, new Hyp(h.cost + t.cost, h, lat.edgeLabel[a]))) break;
                        }
                    }
                }
                // interior cells are no longer needed
                if(!lat.isFinal(v)) cells.set(v, null);
            }
        }

        private List<Hyp> cell(int node, int state) {
            TreeMap<Integer, List<Hyp>> m = cells.get(node);
            if(m == null) {
                m = new TreeMap<Integer, List<Hyp>>();
                cells.set(node, m);
            }
            List<Hyp> l = m.get(state);
            if(l == null) {
                l = new ArrayList<Hyp>();
                m.put(state, l);
            }
            return l;
        }

        /** Inserts after every hypothesis of equal cost; false if it fell off the beam. */
        private boolean offer(List<Hyp> list, Hyp h) {
            if(list.size() == beam && list.get(beam - 1).cost <= h.cost) {
                truncated = true;
                return false;
            }
            int pos = list.size();
            while(pos > 0 && list.get(pos - 1).cost > h.cost) pos--;
            list.add(pos, h);
            if(list.size() > beam) {
                list.remove(list.size() - 1);
                truncated = true;
            }
            return true;
        }

        /** Complete paths with their end-of-sequence cost, cheapest first. */
        List<Hyp> complete() {
            List<Hyp> res = new ArrayList<Hyp>();
            for(int r=0; r<=lat.maxRun; r++) {
                TreeMap<Integer, List<Hyp>> m = cells.get(lat.node(lat.length, r));
                if(m == null) continue;
                for(Map.Entry<Integer, List<Hyp>> e : m.entrySet()) {
                    double fin = model.continuationWeight(e.getKey());
                    for(Hyp h : e.getValue()) {
                        res.add(new Hyp(h.cost + fin, h.prev, h.label));
                    }
                }
            }
            Collections.sort(res, BY_COST);
            return res;
        }
    }
}
