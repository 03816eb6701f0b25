// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

import java.util.Arrays;
import java.util.List;

/**
 * One training example: source and target as symbol-ID sequences.
 */
public final class WordPair {

    private final int [] source;
    private final int [] target;

    public WordPair(int [] source, int [] target) {
        this.source = source.clone();
        this.target = target.clone();
    }

    public static WordPair of(SymbolTable symbols, List<String> source, List<String> target) {
        return new WordPair(symbols.str2seq(source), symbols.str2seq(target));
    }

    public int [] source() { return source.clone(); }
    public int [] target() { return target.clone(); }

    public int sourceLength() { return source.length; }
    public int targetLength() { return target.length; }

    public int sourceAt(int i) { return source[i]; }
    public int targetAt(int j) { return target[j]; }

    @Override
    public boolean equals(Object o) {
        if(!(o instanceof WordPair)) return false;
        WordPair other = (WordPair) o;
        return Arrays.equals(source, other.source) && Arrays.equals(target, other.target);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(source) + Arrays.hashCode(target);
    }

    @Override
    public String toString() {
        return Arrays.toString(source) + " -> " + Arrays.toString(target);
    }
}
