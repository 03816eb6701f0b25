// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

/**
 * A single training pair admits no monotonic segmentation into candidate
 * pairs. The aligner excludes the pair and counts it.
 */
public class AlignmentFailureException extends Exception {

    private static final long serialVersionUID = 1986135526211209530L;

    private final int example;

    public AlignmentFailureException(int example, String message) {
        super(message);
        this.example = example;
    }

    /** Index of the failing pair in the training corpus. */
    public int getExample() { return example; }
}
