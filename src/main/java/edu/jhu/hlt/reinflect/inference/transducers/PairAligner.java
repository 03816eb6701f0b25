// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Logger;

import org.apache.commons.math3.random.RandomGenerator;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Doubles;

import edu.jhu.hlt.reinflect.util.LogMath;

/**
 * Unsupervised many-to-many aligner for (source, target) symbol sequences.
 * <p>
 * The model is a joint distribution p(s:t) over candidate pairs whose sides
 * are at most {@code maxSourceLength} / {@code maxTargetLength} symbols long,
 * one side possibly null. A segmentation of a training pair is a monotonic
 * sequence of candidates whose sources concatenate to the source and whose
 * targets concatenate to the target; its probability is the product of its
 * pairs' probabilities. EM maximizes the corpus log-likelihood, summing over
 * all segmentations of each pair with forward-backward. Because EM finds a
 * local optimum only, training runs from several random starts and keeps the
 * most likely result. Afterwards {@link #align} picks the single best
 * segmentation of each pair.
 * <p>
 * The E-step runs on a worker pool over fixed-size chunks of the corpus. Each
 * chunk accumulates its own counts; after all chunks finish the counts are
 * summed in chunk order, so the result does not depend on the number of
 * workers.
 *
 * @see AlignmentChart
 */
public class PairAligner {

    private static final Logger log = Logger.getLogger(PairAligner.class.getName());

    static final int CHUNK = 64;

    /** relative tolerance before a likelihood decrease is reported */
    static final double LL_TOLERANCE = 1e-8;

    private final SymbolTable symbols;
    private final AlignerOptions opts;

    // moves (a, b): consume a source and b target symbols
    private final int [] da;
    private final int [] db;

    private final ThreadLocal<AlignmentChart> charts = new ThreadLocal<AlignmentChart>() {
        @Override
        protected AlignmentChart initialValue() {
            return new AlignmentChart();
        }
    };

    public PairAligner(SymbolTable symbols, AlignerOptions opts) {
        opts.validate();
        this.symbols = symbols;
        this.opts = opts;
        List<int []> moves = new ArrayList<int []>();
        for(int a=0; a<=opts.maxSourceLength; a++) {
            for(int b=0; b<=opts.maxTargetLength; b++) {
                if(a == 0 && b == 0) continue;
                if(a == 0 && !opts.sourceEpsilon) continue;
                if(b == 0 && !opts.targetEpsilon) continue;
                moves.add(new int[] { a, b });
            }
        }
        da = new int[moves.size()];
        db = new int[moves.size()];
        for(int k=0; k<moves.size(); k++) {
            da[k] = moves.get(k)[0];
            db[k] = moves.get(k)[1];
        }
    }

    public AlignerOptions getOptions() { return opts; }

    public AlignmentModel train(List<WordPair> corpus) {
        return train(corpus, opts.seed, opts.randomStarts);
    }

    /**
     * Runs EM from {@code randomStarts} random initializations, restart r
     * seeded from ({@code seed}, r), and returns the model with the highest
     * final log-likelihood (the earliest restart on ties).
     */
    public AlignmentModel train(List<WordPair> corpus, long seed, int randomStarts) {
        if(corpus.isEmpty())
            throw new DataException(DataException.Reason.EMPTY_CORPUS, "cannot train an aligner on zero pairs");
        if(randomStarts < 1)
            throw new ModelException(ModelException.Reason.INVALID_OPTION,
                                     "randomStarts must be positive, got " + randomStarts);
        checkSymbols(corpus);

        List<AlignedPair> candidates = enumerateCandidates(corpus);
        ImmutableMap<AlignedPair, Integer> index = indexOf(candidates);
        log.info(corpus.size() + " training pairs, " + candidates.size() + " candidate pairs, "
                 + symbols.size() + " symbols");

        List<AlignmentLattice> lattices = new ArrayList<AlignmentLattice>(corpus.size());
        int failures = 0;
        for(int i=0; i<corpus.size(); i++) {
            try {
                lattices.add(AlignmentLattice.encode(i, corpus.get(i), da, db, index));
            } catch(AlignmentFailureException e) {
                log.warning(e.getMessage());
                failures++;
            }
        }
        checkFailures(failures, corpus.size());

        ExecutorService pool = Executors.newFixedThreadPool(opts.threads);
        try {
            AlignmentModel best = null;
            int bestStart = -1;
            for(int r=0; r<randomStarts; r++) {
                long start = System.currentTimeMillis();
                AlignmentModel model = runEM(lattices, candidates, RandomNumberGenerator.forRestart(seed, r),
                                             failures, corpus.size(), pool);
                log.info(String.format("Random start %d; likelihood: %f; iterations: %d; time elapsed: %ds",
                                       r + 1, model.logLikelihood(), model.iterations(),
                                       (System.currentTimeMillis() - start) / 1000));
                if(best == null || model.logLikelihood() > best.logLikelihood()) {
                    best = model;
                    bestStart = r;
                }
            }
            log.info(String.format("Best likelihood: %f (random start %d)", best.logLikelihood(), bestStart + 1));
            return best;
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Best segmentation of every pair under a trained model. Pairs with no
     * segmentation are left out and counted; too many of them is an error.
     */
    public AlignedCorpus align(List<WordPair> corpus, AlignmentModel model) {
        if(corpus.isEmpty())
            throw new DataException(DataException.Reason.EMPTY_CORPUS, "cannot align zero pairs");
        checkSymbols(corpus);

        final List<AlignmentLattice> lattices = new ArrayList<AlignmentLattice>(corpus.size());
        int failures = 0;
        Map<AlignedPair, Integer> index = indexOf(model.pairs());
        for(int i=0; i<corpus.size(); i++) {
            try {
                lattices.add(AlignmentLattice.encode(i, corpus.get(i), da, db, index));
            } catch(AlignmentFailureException e) {
                log.warning(e.getMessage());
                failures++;
            }
        }

        final double [] logp = new double[model.size()];
        for(int k=0; k<logp.length; k++) logp[k] = model.logProbability(k);

        List<Callable<List<int []>>> tasks = new ArrayList<Callable<List<int []>>>();
        for(int from=0; from<lattices.size(); from+=CHUNK) {
            final int lo = from, hi = Math.min(from + CHUNK, lattices.size());
            tasks.add(new Callable<List<int []>>() {
                @Override
                public List<int []> call() {
                    AlignmentChart chart = charts.get();
                    List<int []> paths = new ArrayList<int []>(hi - lo);
                    for(int i=lo; i<hi; i++) {
                        paths.add(chart.viterbi(lattices.get(i), logp));
                    }
                    return paths;
                }
            });
        }

        List<ImmutableList<AlignedPair>> alignments = new ArrayList<ImmutableList<AlignedPair>>();
        List<Integer> examples = new ArrayList<Integer>();
        ExecutorService pool = Executors.newFixedThreadPool(opts.threads);
        try {
            int i = 0;
            for(List<int []> chunk : invokeAll(pool, tasks)) {
                for(int [] path : chunk) {
                    AlignmentLattice lat = lattices.get(i++);
                    if(path == null) {
                        log.warning("training pair " + lat.example + " has no segmentation with positive probability");
                        failures++;
                        continue;
                    }
                    ImmutableList.Builder<AlignedPair> b = ImmutableList.builder();
                    for(int e : path) b.add(model.pair(e));
                    alignments.add(b.build());
                    examples.add(lat.example);
                }
            }
        } finally {
            pool.shutdownNow();
        }
        checkFailures(failures, corpus.size());
        log.info("Aligned " + alignments.size() + " of " + corpus.size() + " pairs");

        int [] ex = new int[examples.size()];
        for(int k=0; k<ex.length; k++) ex[k] = examples.get(k);
        return new AlignedCorpus(symbols, alignments, ex, failures);
    }

    // ---------------- EM ----------------

    private AlignmentModel runEM(List<AlignmentLattice> lattices, List<AlignedPair> candidates, RandomGenerator rng,
                                 int structuralFailures, int corpusSize, ExecutorService pool) {
        double [] probs = initialize(candidates.size(), rng);
        List<Double> history = new ArrayList<Double>();
        double prevll = Double.NEGATIVE_INFINITY;
        for(int iter=0; ; iter++) {
            Expectation ex = expectation(lattices, logs(probs), pool);
            if(ex.failures > 0) {
                log.warning(ex.failures + " training pairs excluded from iteration " + iter);
                checkFailures(structuralFailures + ex.failures, corpusSize);
            }
            double ll = ex.logLikelihood;
            history.add(ll);
            log.fine("Iter " + iter + ": LL=" + ll);
            if(iter > 0 && ll < prevll - LL_TOLERANCE * Math.abs(prevll)) {
                log.warning("log-likelihood decreased at iteration " + iter + ": " + prevll + " -> " + ll);
            }
            if(iter >= opts.maxIterations || (iter > 0 && ll - prevll < opts.delta)) {
                break;
            }
            probs = maximize(ex.counts, probs);
            prevll = ll;
        }
        return new AlignmentModel(candidates, probs, Doubles.toArray(history));
    }

    /** Uniform distribution perturbed by a random factor in [1, 2) per candidate. */
    static double [] initialize(int size, RandomGenerator rng) {
        double [] p = new double[size];
        double z = 0;
        for(int k=0; k<size; k++) {
            p[k] = 1.0 + rng.nextDouble();
            z += p[k];
        }
        for(int k=0; k<size; k++) p[k] /= z;
        return p;
    }

    private static double [] logs(double [] probs) {
        double [] lp = new double[probs.length];
        for(int k=0; k<probs.length; k++) lp[k] = Math.log(probs[k]);
        return lp;
    }

    /** M-step: probabilities proportional to expected counts. */
    static double [] maximize(double [] counts, double [] previous) {
        double total = 0;
        for(double c : counts) total += c;
        if(total <= 0) return previous;
        double [] p = new double[counts.length];
        for(int k=0; k<counts.length; k++) p[k] = counts[k] / total;
        return p;
    }

    static final class Expectation {
        final double [] counts;
        double logLikelihood;
        int failures;

        Expectation(int size) { counts = new double[size]; }

        void add(Expectation other) {
            for(int k=0; k<counts.length; k++) counts[k] += other.counts[k];
            logLikelihood += other.logLikelihood;
            failures += other.failures;
        }
    }

    /**
     * E-step. Each chunk fills a private {@link Expectation}; they are merged
     * in chunk order after every chunk has finished.
     */
    private Expectation expectation(final List<AlignmentLattice> lattices, final double [] logp, ExecutorService pool) {
        List<Callable<Expectation>> tasks = new ArrayList<Callable<Expectation>>();
        for(int from=0; from<lattices.size(); from+=CHUNK) {
            final int lo = from, hi = Math.min(from + CHUNK, lattices.size());
            tasks.add(new Callable<Expectation>() {
                @Override
                public Expectation call() {
                    AlignmentChart chart = charts.get();
                    Expectation ex = new Expectation(logp.length);
                    for(int i=lo; i<hi; i++) {
                        double z = chart.expectedCounts(lattices.get(i), logp, ex.counts);
                        if(z == LogMath.LOG_ZERO) {
                            ex.failures++;
                        } else {
                            ex.logLikelihood += z;
                        }
                    }
                    return ex;
                }
            });
        }
        Expectation total = new Expectation(logp.length);
        for(Expectation ex : invokeAll(pool, tasks)) {
            total.add(ex);
        }
        return total;
    }

    // ---------------- helpers ----------------

    private void checkSymbols(List<WordPair> corpus) {
        for(int i=0; i<corpus.size(); i++) {
            WordPair p = corpus.get(i);
            for(int s=0; s<p.sourceLength(); s++) checkSymbol(i, p.sourceAt(s));
            for(int t=0; t<p.targetLength(); t++) checkSymbol(i, p.targetAt(t));
        }
    }

    private void checkSymbol(int example, int id) {
        if(id <= SymbolTable.EPSILON_ID || id >= symbols.size())
            throw new DataException(DataException.Reason.UNKNOWN_SYMBOL,
                                    "training pair " + example + " uses ID " + id
                                    + ", which is not an interned symbol");
    }

    private void checkFailures(int failures, int total) {
        if(failures == 0) return;
        if(failures >= total || failures > opts.maxFailureFraction * total)
            throw new DataException(DataException.Reason.DEGENERATE_ALIGNMENT,
                                    failures + " of " + total + " training pairs cannot be aligned"
                                    + " (allowed fraction " + opts.maxFailureFraction + ")");
    }

    /** Every pair some cell of some training pair can read, in pair order. */
    private List<AlignedPair> enumerateCandidates(List<WordPair> corpus) {
        TreeSet<AlignedPair> set = new TreeSet<AlignedPair>();
        for(WordPair p : corpus) {
            int [] x = p.source();
            int [] y = p.target();
            for(int i=0; i<=x.length; i++) {
                for(int j=0; j<=y.length; j++) {
                    for(int k=0; k<da.length; k++) {
                        if(i + da[k] <= x.length && j + db[k] <= y.length) {
                            set.add(AlignedPair.slice(x, i, da[k], y, j, db[k]));
                        }
                    }
                }
            }
        }
        return new ArrayList<AlignedPair>(set);
    }

    private static ImmutableMap<AlignedPair, Integer> indexOf(List<AlignedPair> pairs) {
        ImmutableMap.Builder<AlignedPair, Integer> b = ImmutableMap.builder();
        for(int k=0; k<pairs.size(); k++) b.put(pairs.get(k), k);
        return b.build();
    }

    /** Runs the tasks and waits for all of them; results come back in task order. */
    static <T> List<T> invokeAll(ExecutorService pool, List<Callable<T>> tasks) {
        List<T> results = new ArrayList<T>(tasks.size());
        try {
            for(Future<T> f : pool.invokeAll(tasks)) {
                results.add(f.get());
            }
        } catch(InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for workers", e);
        } catch(ExecutionException e) {
            Throwable cause = e.getCause();
            if(cause instanceof RuntimeException) throw (RuntimeException) cause;
            if(cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException(cause);
        }
        return results;
    }
}
