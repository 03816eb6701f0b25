// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Independent Mersenne Twister streams, one per random restart, so restarts
 * can run in any order and still reproduce.
 */
public class RandomNumberGenerator {

    private RandomNumberGenerator() {}

    /** The stream for restart {@code restart} of a run seeded with {@code seed}. */
    static public RandomGenerator forRestart(long seed, int restart) {
        return new MersenneTwister(new int[] { (int) (seed >>> 32), (int) seed, restart });
    }
}
