// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * One decoded output sequence and its path cost (negative natural log
 * probability under the pair n-gram model).
 */
public final class ScoredOutput {

    private final ImmutableList<String> output;
    private final List<AlignedPair> path;
    private final double cost;

    ScoredOutput(List<String> output, List<AlignedPair> path, double cost) {
        this.output = ImmutableList.copyOf(output);
        this.path = ImmutableList.copyOf(path);
        this.cost = cost;
    }

    public List<String> output() { return output; }

    /** Pairs along the best path producing this output. */
    public List<AlignedPair> path() { return path; }

    public double cost() { return cost; }

    @Override
    public String toString() {
        return output + " (" + cost + ")";
    }
}
