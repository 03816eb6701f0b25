// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

import java.util.Arrays;
import java.util.Comparator;

import com.google.common.primitives.Ints;

/**
 * A (source-subsequence, target-subsequence) pair of symbol IDs. An empty side
 * is the null marker: an empty source is an insertion, an empty target a
 * deletion. Both sides empty is not a pair.
 * <p>
 * Pairs order lexicographically by source, then target; every tie-break in
 * alignment and decoding follows this order.
 */
public final class AlignedPair implements Comparable<AlignedPair> {

    private static final Comparator<int []> LEX = Ints.lexicographicalComparator();

    private final int [] source;
    private final int [] target;
    private final int hash;

    public AlignedPair(int [] source, int [] target) {
        if(source.length == 0 && target.length == 0)
            throw new IllegalArgumentException("(null, null) is not an aligned pair");
        for(int id : source) checkId(id);
        for(int id : target) checkId(id);
        this.source = source.clone();
        this.target = target.clone();
        this.hash = 31 * Arrays.hashCode(this.source) + Arrays.hashCode(this.target);
    }

    private static void checkId(int id) {
        if(id <= SymbolTable.EPSILON_ID)
            throw new IllegalArgumentException("pair sides hold real symbols only, found ID " + id);
    }

    /** Copies {@code len} symbols from each array starting at the given offsets. */
    public static AlignedPair slice(int [] x, int i, int a, int [] y, int j, int b) {
        return new AlignedPair(Arrays.copyOfRange(x, i, i + a), Arrays.copyOfRange(y, j, j + b));
    }

    public int [] source() { return source.clone(); }
    public int [] target() { return target.clone(); }

    public int sourceLength() { return source.length; }
    public int targetLength() { return target.length; }

    public boolean isInsertion() { return source.length == 0; }
    public boolean isDeletion() { return target.length == 0; }

    /** Renders the pair as "source:target" with symbols from the table. */
    public String format(SymbolTable symbols) {
        return side(source, symbols) + ":" + side(target, symbols);
    }

    private static String side(int [] ids, SymbolTable symbols) {
        if(ids.length == 0) return SymbolTable.EPSILON;
        StringBuilder sb = new StringBuilder();
        for(int i=0; i<ids.length; i++) {
            if(i > 0) sb.append('+');
            sb.append(symbols.lookup(ids[i]));
        }
        return sb.toString();
    }

    /** Space-separated IDs, or "0" for the null side. */
    static String encodeSide(int [] ids) {
        if(ids.length == 0) return Integer.toString(SymbolTable.EPSILON_ID);
        StringBuilder sb = new StringBuilder();
        for(int i=0; i<ids.length; i++) {
            if(i > 0) sb.append(' ');
            sb.append(ids[i]);
        }
        return sb.toString();
    }

    static int [] decodeSide(String s) {
        String [] parts = s.trim().split(" ");
        if(parts.length == 1 && Integer.parseInt(parts[0]) == SymbolTable.EPSILON_ID) return new int[0];
        int [] ids = new int[parts.length];
        for(int i=0; i<parts.length; i++) {
            ids[i] = Integer.parseInt(parts[i]);
        }
        return ids;
    }

    @Override
    public int compareTo(AlignedPair o) {
        int c = LEX.compare(source, o.source);
        if(c != 0) return c;
        return LEX.compare(target, o.target);
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) return true;
        if(!(o instanceof AlignedPair)) return false;
        AlignedPair other = (AlignedPair) o;
        return hash == other.hash && Arrays.equals(source, other.source) && Arrays.equals(target, other.target);
    }

    @Override
    public int hashCode() { return hash; }

    @Override
    public String toString() {
        return encodeSide(source) + ":" + encodeSide(target);
    }
}
