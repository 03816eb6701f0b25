// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ListMultimap;
import com.google.common.primitives.Ints;

/**
 * Every segmentation of one source sequence into pairs of the model's
 * alphabet. Node (i, r) means i source symbols consumed, the last r pairs
 * being insertions; node index is {@code i * (maxRun + 1) + r}, which is a
 * topological order. A pair with a non-empty source of length a leads from
 * (i, r) to (i + a, 0); an insertion leads to (i, r + 1) while r &lt; maxRun.
 * Edges are stored per node in label order. Only nodes reachable from (0, 0)
 * get edges.
 */
final class Lattice {

    final int length;
    final int maxRun;
    final int numNodes;
    final int [] edgeStart;  // edges of node v are [edgeStart[v], edgeStart[v+1])
    final int [] edgeLabel;
    final int [] edgeDest;
    final boolean [] reachable;

    private Lattice(int length, int maxRun, int [] edgeStart, int [] edgeLabel, int [] edgeDest, boolean [] reachable) {
        this.length = length;
        this.maxRun = maxRun;
        this.numNodes = edgeStart.length - 1;
        this.edgeStart = edgeStart;
        this.edgeLabel = edgeLabel;
        this.edgeDest = edgeDest;
        this.reachable = reachable;
    }

    int node(int i, int run) { return i * (maxRun + 1) + run; }

    int position(int node) { return node / (maxRun + 1); }

    boolean isFinal(int node) { return position(node) == length; }

    /** True if some path from (0, 0) consumes the whole source. */
    boolean hasPath() {
        for(int r=0; r<=maxRun; r++) {
            if(reachable[node(length, r)]) return true;
        }
        return false;
    }

    /**
     * @param bySource  labels of the non-insertion pairs keyed by source side, each list ascending
     * @param insertions labels of the insertion pairs, ascending
     * @param maxSource longest source side in the alphabet
     */
    static Lattice build(int [] x, ListMultimap<List<Integer>, Integer> bySource, int [] insertions,
                         int maxSource, int maxRun) {
        int n = x.length;
        int width = maxRun + 1;
        int nodes = (n + 1) * width;
        boolean [] reachable = new boolean[nodes];
        reachable[0] = true;
        int [] edgeStart = new int[nodes + 1];
        int [] label = new int[16];
        int [] dest = new int[16];
        int count = 0;
        for(int v=0; v<nodes; v++) {
            edgeStart[v] = count;
            if(!reachable[v]) continue;
            int i = v / width, r = v % width;
            // merge consuming and insertion edges into label order
            int [] out = new int[0];
            int [] to = new int[0];
            for(int a=1; a<=maxSource && i+a<=n; a++) {
                List<Integer> labels = bySource.get(Ints.asList(Arrays.copyOfRange(x, i, i + a)));
                int base = out.length;
                out = Arrays.copyOf(out, base + labels.size());
                to = Arrays.copyOf(to, base + labels.size());
                for(int k=0; k<labels.size(); k++) {
                    out[base + k] = labels.get(k);
                    to[base + k] = (i + a) * width;
                }
            }
            if(r < maxRun) {
                int base = out.length;
                out = Arrays.copyOf(out, base + insertions.length);
                to = Arrays.copyOf(to, base + insertions.length);
                for(int k=0; k<insertions.length; k++) {
                    out[base + k] = insertions[k];
                    to[base + k] = v + 1;
                }
            }
            sortByLabel(out, to);
            if(count + out.length > label.length) {
                int size = Math.max(count + out.length, 2 * label.length);
                label = Arrays.copyOf(label, size);
                dest = Arrays.copyOf(dest, size);
            }
            for(int k=0; k<out.length; k++) {
                label[count] = out[k];
                dest[count] = to[k];
                reachable[to[k]] = true;
                count++;
            }
        }
        edgeStart[nodes] = count;
        return new Lattice(n, maxRun, edgeStart, Arrays.copyOf(label, count), Arrays.copyOf(dest, count), reachable);
    }

    // insertion sort; edge lists are short
    private static void sortByLabel(int [] label, int [] dest) {
        for(int i=1; i<label.length; i++) {
            int l = label[i], d = dest[i];
            int j = i - 1;
            while(j >= 0 && label[j] > l) {
                label[j + 1] = label[j];
                dest[j + 1] = dest[j];
                j--;
            }
            label[j + 1] = l;
            dest[j + 1] = d;
        }
    }
}
