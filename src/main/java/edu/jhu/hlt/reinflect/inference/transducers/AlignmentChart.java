// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

import java.util.Arrays;

import edu.jhu.hlt.reinflect.util.LogMath;

/**
 * Dynamic-programming tables for one worker, grown on demand and reused
 * across training pairs. All scores are natural-log probabilities.
 *
 * Cells are visited in row-major order; every edge leads to a later cell,
 * so one sweep in each direction suffices.
 */
final class AlignmentChart {

    private double [] alpha = new double[0];
    private double [] beta = new double[0];
    private int [] backCell = new int[0];
    private int [] backEdge = new int[0];

    private void ensure(int cells) {
        if(alpha.length < cells) {
            int size = Math.max(cells, 2 * alpha.length);
            alpha = new double[size];
            beta = new double[size];
            backCell = new int[size];
            backEdge = new int[size];
        }
    }

    /** log of the summed probability of every segmentation */
    double forward(AlignmentLattice lat, double [] logp) {
        ensure(lat.cells);
        Arrays.fill(alpha, 0, lat.cells, LogMath.LOG_ZERO);
        alpha[lat.start()] = 0.0;
        for(int c=0; c<lat.cells; c++) {
            double a = alpha[c];
            if(a == LogMath.LOG_ZERO) continue;
            int base = c * lat.moves;
            for(int k=0; k<lat.moves; k++) {
                int e = lat.edges[base + k];
                if(e < 0) continue;
                double lp = logp[e];
                if(lp == LogMath.LOG_ZERO) continue;
                int nc = c + lat.step[k];
                alpha[nc] = LogMath.logAdd(alpha[nc], a + lp);
            }
        }
        return alpha[lat.end()];
    }

    /**
     * Forward-backward: adds the posterior expected count of every candidate
     * into {@code counts} and returns the log-likelihood of the pair, or
     * {@code LOG_ZERO} (adding nothing) if no segmentation has positive
     * probability.
     */
    double expectedCounts(AlignmentLattice lat, double [] logp, double [] counts) {
        double z = forward(lat, logp);
        if(z == LogMath.LOG_ZERO) return z;

        Arrays.fill(beta, 0, lat.cells, LogMath.LOG_ZERO);
        beta[lat.end()] = 0.0;
        for(int c=lat.cells-1; c>=0; c--) {
            int base = c * lat.moves;
            double b = beta[c];
            for(int k=0; k<lat.moves; k++) {
                int e = lat.edges[base + k];
                if(e < 0) continue;
                double lp = logp[e];
                if(lp == LogMath.LOG_ZERO) continue;
                int nc = c + lat.step[k];
                if(beta[nc] == LogMath.LOG_ZERO) continue;
                b = LogMath.logAdd(b, lp + beta[nc]);
            }
            beta[c] = b;
        }
        double zReverse = beta[lat.start()];
        assert Math.abs(z - zReverse) < 1e-6 * Math.max(1.0, Math.abs(z))
            : "Forward probability != backward probability (" + z + " != " + zReverse + ")";

        for(int c=0; c<lat.cells; c++) {
            double a = alpha[c];
            if(a == LogMath.LOG_ZERO) continue;
            int base = c * lat.moves;
            for(int k=0; k<lat.moves; k++) {
                int e = lat.edges[base + k];
                if(e < 0) continue;
                double lp = logp[e];
                if(lp == LogMath.LOG_ZERO) continue;
                double bn = beta[c + lat.step[k]];
                if(bn == LogMath.LOG_ZERO) continue;
                counts[e] += Math.exp(a + lp + bn - z);
            }
        }
        return z;
    }

    /**
     * Best single segmentation as a sequence of candidate indices, or null if
     * none has positive probability. Among equal scores the edge with the
     * lower candidate index wins.
     */
    int [] viterbi(AlignmentLattice lat, double [] logp) {
        ensure(lat.cells);
        Arrays.fill(alpha, 0, lat.cells, LogMath.LOG_ZERO);
        Arrays.fill(backEdge, 0, lat.cells, -1);
        alpha[lat.start()] = 0.0;
        for(int c=0; c<lat.cells; c++) {
            double a = alpha[c];
            if(a == LogMath.LOG_ZERO) continue;
            int base = c * lat.moves;
            for(int k=0; k<lat.moves; k++) {
                int e = lat.edges[base + k];
                if(e < 0) continue;
                double lp = logp[e];
                if(lp == LogMath.LOG_ZERO) continue;
                int nc = c + lat.step[k];
                double s = a + lp;
                if(s > alpha[nc] || (s == alpha[nc] && e < backEdge[nc])) {
                    alpha[nc] = s;
                    backCell[nc] = c;
                    backEdge[nc] = e;
                }
            }
        }
        if(alpha[lat.end()] == LogMath.LOG_ZERO) return null;

        int len = 0;
        for(int c=lat.end(); c!=lat.start(); c=backCell[c]) len++;
        int [] path = new int[len];
        int c = lat.end();
        for(int t=len-1; t>=0; t--) {
            path[t] = backEdge[c];
            c = backCell[c];
        }
        return path;
    }

    /** Score of the last {@link #viterbi} path. */
    double viterbiScore(AlignmentLattice lat) {
        return alpha[lat.end()];
    }
}
