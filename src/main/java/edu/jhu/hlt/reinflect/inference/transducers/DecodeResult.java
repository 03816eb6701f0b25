// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Outcome of decoding one input of a batch: either the ranked outputs or the
 * failure that stopped this input.
 */
public final class DecodeResult {

    private final ImmutableList<String> source;
    private final ImmutableList<ScoredOutput> outputs;
    private final DecodeFailureException failure;

    private DecodeResult(List<String> source, List<ScoredOutput> outputs, DecodeFailureException failure) {
        this.source = ImmutableList.copyOf(source);
        this.outputs = outputs == null ? ImmutableList.<ScoredOutput>of() : ImmutableList.copyOf(outputs);
        this.failure = failure;
    }

    static DecodeResult success(List<String> source, List<ScoredOutput> outputs) {
        return new DecodeResult(source, outputs, null);
    }

    static DecodeResult failure(List<String> source, DecodeFailureException failure) {
        return new DecodeResult(source, null, failure);
    }

    public List<String> source() { return source; }

    public boolean isSuccess() { return failure == null; }

    /** Outputs in order of increasing cost; empty on failure. */
    public List<ScoredOutput> outputs() { return outputs; }

    public ScoredOutput best() {
        if(failure != null) throw new IllegalStateException("decoding failed: " + failure.getMessage());
        return outputs.get(0);
    }

    /** The failure, or null on success. */
    public DecodeFailureException failure() { return failure; }

    @Override
    public String toString() {
        return source + " -> " + (failure == null ? outputs.toString() : failure.getReason().toString());
    }
}
