// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

import java.util.Arrays;
import java.util.Comparator;

import com.google.common.primitives.Ints;

/**
 * A history of pair labels, oldest first. Label {@link #BOUNDARY} stands for
 * the start of the sequence and can only appear first.
 */
public final class NGramContext implements Comparable<NGramContext> {

    public static final int BOUNDARY = 0;

    public static final NGramContext EMPTY = new NGramContext(new int[0]);
    public static final NGramContext START = new NGramContext(new int[] { BOUNDARY });

    private static final Comparator<int []> LEX = Ints.lexicographicalComparator();

    private final int [] labels;

    public NGramContext(int [] labels) {
        this.labels = labels.clone();
    }

    public int length() { return labels.length; }

    public int label(int i) { return labels[i]; }

    public int [] labels() { return labels.clone(); }

    /** Drops the oldest label. */
    public NGramContext backoff() {
        if(labels.length == 0) throw new IllegalStateException("empty context has no backoff");
        return new NGramContext(Arrays.copyOfRange(labels, 1, labels.length));
    }

    /** Appends a label and keeps at most the last {@code maxLength}. */
    public NGramContext extend(int label, int maxLength) {
        int len = Math.min(labels.length + 1, maxLength);
        if(len == 0) return EMPTY;
        int [] res = new int[len];
        int keep = len - 1;
        System.arraycopy(labels, labels.length - keep, res, 0, keep);
        res[len - 1] = label;
        return new NGramContext(res);
    }

    @Override
    public int compareTo(NGramContext o) {
        if(labels.length != o.labels.length) return labels.length - o.labels.length;
        return LEX.compare(labels, o.labels);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NGramContext && Arrays.equals(labels, ((NGramContext) o).labels);
    }

    @Override
    public int hashCode() { return Arrays.hashCode(labels); }

    @Override
    public String toString() { return Arrays.toString(labels); }
}
