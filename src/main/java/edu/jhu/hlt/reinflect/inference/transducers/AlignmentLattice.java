// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

import java.util.Map;

/**
 * The segmentation space of one training pair, precomputed once so that EM
 * iterations only do arithmetic. Cells are (source prefix, target prefix)
 * lengths laid out row-major in a flat array; from each cell there is one
 * potential edge per move (a, b), which consumes a source and b target
 * symbols. {@code edges[cell * moves + k]} holds the candidate index of the
 * pair that move k reads, or -1 where the move runs off the end or reads a
 * pair that is not a candidate.
 */
final class AlignmentLattice {

    final int example;
    final int n;        // source length
    final int m;        // target length
    final int cells;
    final int moves;
    final int [] step;  // cell offset of each move
    final int [] edges;

    private AlignmentLattice(int example, int n, int m, int moves, int [] step, int [] edges) {
        this.example = example;
        this.n = n;
        this.m = m;
        this.cells = (n + 1) * (m + 1);
        this.moves = moves;
        this.step = step;
        this.edges = edges;
    }

    int start() { return 0; }

    int end() { return cells - 1; }

    /**
     * Builds the lattice of {@code pair} under the moves {@code da[k], db[k]}.
     *
     * @throws AlignmentFailureException if no edge path joins the first and last cells
     */
    static AlignmentLattice encode(int example, WordPair pair, int [] da, int [] db,
                                   Map<AlignedPair, Integer> candidates) throws AlignmentFailureException {
        int [] x = pair.source();
        int [] y = pair.target();
        int n = x.length, m = y.length;
        int moves = da.length;
        int [] step = new int[moves];
        for(int k=0; k<moves; k++) {
            step[k] = da[k] * (m + 1) + db[k];
        }
        int cells = (n + 1) * (m + 1);
        int [] edges = new int[cells * moves];
        boolean [] reached = new boolean[cells];
        reached[0] = true;
        for(int i=0; i<=n; i++) {
            for(int j=0; j<=m; j++) {
                int c = i * (m + 1) + j;
                for(int k=0; k<moves; k++) {
                    int e = -1;
                    if(i + da[k] <= n && j + db[k] <= m) {
                        Integer idx = candidates.get(AlignedPair.slice(x, i, da[k], y, j, db[k]));
                        if(idx != null) e = idx;
                    }
                    edges[c * moves + k] = e;
                    if(e >= 0 && reached[c]) reached[c + step[k]] = true;
                }
            }
        }
        if(!reached[cells - 1])
            throw new AlignmentFailureException(example, "training pair " + example + " (" + pair
                                                + ") has no segmentation into candidate pairs");
        return new AlignmentLattice(example, n, m, moves, step, edges);
    }
}
