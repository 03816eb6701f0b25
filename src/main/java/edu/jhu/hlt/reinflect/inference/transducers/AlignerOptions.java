// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

import java.io.IOException;

import edu.jhu.hlt.reinflect.util.ReinflectConfig;

/**
 * Settings for {@link PairAligner}. Defaults follow the original
 * grapheme-to-phoneme aligner: one symbol or the null marker per side,
 * 10 random starts, at most 50 iterations, delta of 1/1024.
 */
public class AlignerOptions {

    public int maxSourceLength = 1;
    public int maxTargetLength = 1;
    /** allow pairs with an empty source (insertions) */
    public boolean sourceEpsilon = true;
    /** allow pairs with an empty target (deletions) */
    public boolean targetEpsilon = true;

    public int randomStarts = 10;
    public long seed = 0;
    public int maxIterations = 50;
    /** EM stops once the corpus log-likelihood improves by less than this */
    public double delta = 1.0 / 1024;
    /** fraction of training pairs allowed to have no alignment */
    public double maxFailureFraction = 0.05;
    public int threads = Runtime.getRuntime().availableProcessors();

    public static AlignerOptions fromConfig() throws IOException {
        AlignerOptions o = new AlignerOptions();
        o.maxSourceLength = ReinflectConfig.getInt(ReinflectConfig.ALIGNER_MAX_SOURCE_LENGTH, o.maxSourceLength);
        o.maxTargetLength = ReinflectConfig.getInt(ReinflectConfig.ALIGNER_MAX_TARGET_LENGTH, o.maxTargetLength);
        o.sourceEpsilon = ReinflectConfig.getBoolean(ReinflectConfig.ALIGNER_SOURCE_EPSILON, o.sourceEpsilon);
        o.targetEpsilon = ReinflectConfig.getBoolean(ReinflectConfig.ALIGNER_TARGET_EPSILON, o.targetEpsilon);
        o.randomStarts = ReinflectConfig.getInt(ReinflectConfig.ALIGNER_RANDOM_STARTS, o.randomStarts);
        o.seed = ReinflectConfig.getLong(ReinflectConfig.ALIGNER_SEED, o.seed);
        o.maxIterations = ReinflectConfig.getInt(ReinflectConfig.ALIGNER_MAX_ITERATIONS, o.maxIterations);
        o.delta = ReinflectConfig.getDouble(ReinflectConfig.ALIGNER_DELTA, o.delta);
        o.maxFailureFraction = ReinflectConfig.getDouble(ReinflectConfig.ALIGNER_MAX_FAILURE_FRACTION, o.maxFailureFraction);
        o.threads = ReinflectConfig.getInt(ReinflectConfig.ALIGNER_THREADS, o.threads);
        return o;
    }

    void validate() {
        if(maxSourceLength < 1 || maxSourceLength > 2)
            throw invalid("maxSourceLength must be 1 or 2, got " + maxSourceLength);
        if(maxTargetLength < 1 || maxTargetLength > 2)
            throw invalid("maxTargetLength must be 1 or 2, got " + maxTargetLength);
        if(randomStarts < 1)
            throw invalid("randomStarts must be positive, got " + randomStarts);
        if(maxIterations < 0)
            throw invalid("maxIterations must be non-negative, got " + maxIterations);
        if(!(delta >= 0))
            throw invalid("delta must be non-negative, got " + delta);
        if(!(maxFailureFraction >= 0 && maxFailureFraction <= 1))
            throw invalid("maxFailureFraction must lie in [0, 1], got " + maxFailureFraction);
        if(threads < 1)
            throw invalid("threads must be positive, got " + threads);
    }

    private static ModelException invalid(String message) {
        return new ModelException(ModelException.Reason.INVALID_OPTION, message);
    }

    @Override
    public String toString() {
        return "AlignerOptions(maxSource=" + maxSourceLength + " maxTarget=" + maxTargetLength
            + " sourceEps=" + sourceEpsilon + " targetEps=" + targetEpsilon
            + " starts=" + randomStarts + " seed=" + seed + " maxIter=" + maxIterations
            + " delta=" + delta + " maxFailures=" + maxFailureFraction + " threads=" + threads + ")";
    }
}
