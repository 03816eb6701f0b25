// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

/**
 * Bad input data handed to training or decoding: an empty corpus, a symbol or
 * ID the table does not know, a malformed line, or too many training pairs
 * that admit no alignment. Aborts the operation that received it.
 */
public class DataException extends RuntimeException {

    private static final long serialVersionUID = 4410832912771050121L;

    public static enum Reason {
        EMPTY_CORPUS,
        UNKNOWN_SYMBOL,
        UNKNOWN_ID,
        MALFORMED_INPUT,
        DEGENERATE_ALIGNMENT,
        EMPTY_ALIGNED_CORPUS,
        SYMBOL_TABLE_MISMATCH
    }

    private final Reason reason;

    public DataException(Reason reason, String message) {
        super(reason + ": " + message);
        this.reason = reason;
    }

    public DataException(Reason reason, String message, Throwable cause) {
        super(reason + ": " + message, cause);
        this.reason = reason;
    }

    public Reason getReason() { return reason; }
}
