// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.util;

/**
 * Arithmetic on natural-log probabilities. Zero probability is
 * {@code Double.NEGATIVE_INFINITY}.
 */
public final class LogMath {

    public static final double LOG_ZERO = Double.NEGATIVE_INFINITY;

    private LogMath() {}

    /** log(exp(a) + exp(b)) */
    public static double logAdd(double a, double b) {
        if(a == LOG_ZERO) return b;
        if(b == LOG_ZERO) return a;
        if(a > b) return a + Math.log1p(Math.exp(b - a));
        return b + Math.log1p(Math.exp(a - b));
    }

    /** Cost (negative natural log) of a probability; infinite for zero, +0.0 for one. */
    public static double cost(double p) {
        if(p == 1.0) return 0.0;
        return -Math.log(p);
    }

    public static double probability(double cost) {
        return Math.exp(-cost);
    }
}
