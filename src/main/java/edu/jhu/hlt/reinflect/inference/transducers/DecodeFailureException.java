// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

/** One input could not be decoded. Local to that input. */
public class DecodeFailureException extends Exception {

    private static final long serialVersionUID = -6403318470285312215L;

    public static enum Reason {
        /** the source has a symbol the table has never seen */
        UNKNOWN_SYMBOL,
        /** no pair sequence under the model covers the source */
        NO_PATH
    }

    private final Reason reason;

    public DecodeFailureException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() { return reason; }
}
