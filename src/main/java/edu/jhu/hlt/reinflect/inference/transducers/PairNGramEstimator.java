// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Doubles;
import com.google.common.primitives.Ints;

import edu.jhu.hlt.reinflect.util.LogMath;

/**
 * Estimates a {@link PairNGramModel} from an aligned corpus with
 * interpolated Kneser-Ney smoothing.
 * <p>
 * Every aligned example is read as BOS p1 ... pL EOS. N-grams of the highest
 * order, and lower-order n-grams whose history starts at BOS, are counted
 * directly; the remaining lower-order n-grams get continuation counts (the
 * number of distinct symbols seen immediately to their left). Each order has
 * one absolute discount D, and
 * <pre>
 *   p(w | h) = max(c(h w) - D, 0) / c(h) + D N1+(h) / c(h) * p(w | h')
 * </pre>
 * where h' drops the oldest symbol of h. The empty history interpolates with
 * the uniform distribution over every pair plus EOS, so every pair has
 * positive probability after every history.
 */
public class PairNGramEstimator {

    private static final Logger log = Logger.getLogger(PairNGramEstimator.class.getName());

    /** Event label for the end of the sequence; shares its value with {@link NGramContext#BOUNDARY}. */
    static final int EOS = 0;

    static final double FALLBACK_DISCOUNT = 0.5;

    private final double fixedDiscount;

    /** Estimates one discount per order from count-of-counts. */
    public PairNGramEstimator() {
        this.fixedDiscount = Double.NaN;
    }

    /** Uses {@code discount} at every order. */
    public PairNGramEstimator(double discount) {
        if(!(discount > 0.0 && discount < 1.0))
            throw new ModelException(ModelException.Reason.INVALID_OPTION,
                                     "discount must be in (0, 1), got " + discount);
        this.fixedDiscount = discount;
    }

    /** Counts, discount and interpolation weight for one history. */
    private static final class History {
        final TreeMap<Integer, Double> counts = new TreeMap<Integer, Double>();
        final Map<Integer, Double> probs = new TreeMap<Integer, Double>();
        double total;
        double lambda;

        void add(int event, double c) {
            Double old = counts.get(event);
            counts.put(event, old == null ? c : old + c);
        }
    }

    public PairNGramModel train(AlignedCorpus corpus, int order) {
        if(order < 1)
            throw new ModelException(ModelException.Reason.INVALID_ORDER, "n-gram order must be at least 1, got " + order);
        if(corpus.size() == 0)
            throw new DataException(DataException.Reason.EMPTY_ALIGNED_CORPUS, "cannot estimate a model from zero aligned examples");

        // pair alphabet, labels 1..P in pair order
        TreeSet<AlignedPair> alphabet = new TreeSet<AlignedPair>();
        for(List<AlignedPair> alignment : corpus) alphabet.addAll(alignment);
        List<AlignedPair> pairs = new ArrayList<AlignedPair>(alphabet);
        ImmutableMap.Builder<AlignedPair, Integer> lb = ImmutableMap.builder();
        for(int k=0; k<pairs.size(); k++) lb.put(pairs.get(k), k + 1);
        ImmutableMap<AlignedPair, Integer> labels = lb.build();
        int vocab = pairs.size() + 1;

        // raw[k]: histories of length k
        List<TreeMap<NGramContext, History>> raw = new ArrayList<TreeMap<NGramContext, History>>();
        for(int k=0; k<order; k++) raw.add(new TreeMap<NGramContext, History>());
        int insertionRun = 0;
        for(List<AlignedPair> alignment : corpus) {
            int [] seq = new int[alignment.size() + 2];
            seq[0] = NGramContext.BOUNDARY;
            int run = 0;
            for(int t=0; t<alignment.size(); t++) {
                AlignedPair p = alignment.get(t);
                seq[t + 1] = labels.get(p);
                run = p.isInsertion() ? run + 1 : 0;
                insertionRun = Math.max(insertionRun, run);
            }
            seq[seq.length - 1] = EOS;
            for(int t=1; t<seq.length; t++) {
                for(int k=0; k<order && k<=t; k++) {
                    int [] h = new int[k];
                    System.arraycopy(seq, t - k, h, 0, k);
                    history(raw.get(k), new NGramContext(h)).add(seq[t], 1.0);
                }
            }
        }

        // Kneser-Ney adjusted counts
        List<TreeMap<NGramContext, History>> adjusted = new ArrayList<TreeMap<NGramContext, History>>();
        for(int k=0; k<order; k++) {
            if(k == order - 1) {
                adjusted.add(raw.get(k));
                continue;
            }
            TreeMap<NGramContext, History> level = new TreeMap<NGramContext, History>();
            for(Map.Entry<NGramContext, History> e : raw.get(k).entrySet()) {
                if(startsAtBoundary(e.getKey())) level.put(e.getKey(), e.getValue());
            }
            for(Map.Entry<NGramContext, History> e : raw.get(k + 1).entrySet()) {
                NGramContext lower = e.getKey().backoff();
                if(startsAtBoundary(lower)) continue;
                History h = history(level, lower);
                for(int event : e.getValue().counts.keySet()) h.add(event, 1.0);
            }
            adjusted.add(level);
        }

        double [] discounts = new double[order];
        for(int k=0; k<order; k++) {
            discounts[k] = Double.isNaN(fixedDiscount) ? estimateDiscount(adjusted.get(k)) : fixedDiscount;
            log.info(String.format("Order %d: %d histories, discount %f", k + 1, adjusted.get(k).size(), discounts[k]));
        }

        // interpolated probabilities, lowest order first
        for(int k=0; k<order; k++) {
            double d = discounts[k];
            for(Map.Entry<NGramContext, History> e : adjusted.get(k).entrySet()) {
                History h = e.getValue();
                h.total = 0;
                for(double c : h.counts.values()) h.total += c;
                h.lambda = d * h.counts.size() / h.total;
                for(Map.Entry<Integer, Double> c : h.counts.entrySet()) {
                    double lower = k == 0 ? 1.0 / vocab : probability(adjusted, k - 1, e.getKey().backoff(), c.getKey(), vocab);
                    h.probs.put(c.getKey(), Math.max(c.getValue() - d, 0.0) / h.total + h.lambda * lower);
                }
            }
        }

        // states in context order, the empty history first
        List<NGramContext> contexts = new ArrayList<NGramContext>();
        for(int k=0; k<order; k++) contexts.addAll(adjusted.get(k).keySet());
        ImmutableMap.Builder<NGramContext, Integer> sb = ImmutableMap.builder();
        for(int s=0; s<contexts.size(); s++) sb.put(contexts.get(s), s);
        ImmutableMap<NGramContext, Integer> states = sb.build();

        int n = contexts.size();
        int [] backoffState = new int[n];
        double [] backoffWeight = new double[n];
        double [] finalWeight = new double[n];
        int [] arcStart = new int[n + 1];
        List<Integer> arcLabel = new ArrayList<Integer>();
        List<Integer> arcDest = new ArrayList<Integer>();
        List<Double> arcWeight = new ArrayList<Double>();
        for(int s=0; s<n; s++) {
            NGramContext ctx = contexts.get(s);
            int k = ctx.length();
            History h = adjusted.get(k).get(ctx);
            arcStart[s] = arcLabel.size();
            if(k == 0) {
                backoffState[s] = -1;
                backoffWeight[s] = 0.0;
                for(int label=1; label<vocab; label++) {
                    arcLabel.add(label);
                    arcDest.add(destination(states, ctx, label, order));
                    arcWeight.add(LogMath.cost(probability(adjusted, 0, ctx, label, vocab)));
                }
            } else {
                backoffState[s] = states.get(ctx.backoff());
                backoffWeight[s] = LogMath.cost(h.lambda);
                for(Map.Entry<Integer, Double> p : h.probs.entrySet()) {
                    if(p.getKey() == EOS) continue;
                    arcLabel.add(p.getKey());
                    arcDest.add(destination(states, ctx, p.getKey(), order));
                    arcWeight.add(LogMath.cost(p.getValue()));
                }
            }
            finalWeight[s] = LogMath.cost(probability(adjusted, k, ctx, EOS, vocab));
        }
        arcStart[n] = arcLabel.size();

        NGramContext start = order >= 2 ? NGramContext.START : NGramContext.EMPTY;
        PairNGramModel model = new PairNGramModel(order, corpus.symbols().fingerprint(), insertionRun, pairs,
                                                  contexts.toArray(new NGramContext[n]), states.get(start),
                                                  backoffState, backoffWeight, finalWeight, arcStart,
                                                  Ints.toArray(arcLabel), Ints.toArray(arcDest), Doubles.toArray(arcWeight));
        log.info("Estimated " + model);
        return model;
    }

    private static boolean startsAtBoundary(NGramContext h) {
        return h.length() > 0 && h.label(0) == NGramContext.BOUNDARY;
    }

    private static History history(TreeMap<NGramContext, History> level, NGramContext h) {
        History res = level.get(h);
        if(res == null) {
            res = new History();
            level.put(h, res);
        }
        return res;
    }

    /**
     * D = n1 / (n1 + 2 n2) from the adjusted counts of one order, or
     * {@link #FALLBACK_DISCOUNT} when n1 or n2 is zero. D stays below 1, so
     * every explicit arc keeps mass of its own.
     */
    private static double estimateDiscount(Map<NGramContext, History> level) {
        long n1 = 0, n2 = 0;
        for(History h : level.values()) {
            for(double c : h.counts.values()) {
                if(c == 1.0) n1++;
                else if(c == 2.0) n2++;
            }
        }
        if(n1 == 0 || n2 == 0) return FALLBACK_DISCOUNT;
        return (double) n1 / (n1 + 2 * n2);
    }

    /** p(event | h) for a history of length k that was seen at that order. */
    private static double probability(List<TreeMap<NGramContext, History>> adjusted, int k, NGramContext h,
                                      int event, int vocab) {
        History hist = adjusted.get(k).get(h);
        Double p = hist.probs.get(event);
        if(p != null) return p;
        double lower = k == 0 ? 1.0 / vocab : probability(adjusted, k - 1, h.backoff(), event, vocab);
        return hist.lambda * lower;
    }

    /** Longest state that is a suffix of {@code h} followed by {@code label}. */
    private static int destination(Map<NGramContext, Integer> states, NGramContext h, int label, int order) {
        NGramContext next = h.extend(label, order - 1);
        Integer s = states.get(next);
        while(s == null) {
            next = next.backoff();
            s = states.get(next);
        }
        return s;
    }
}
