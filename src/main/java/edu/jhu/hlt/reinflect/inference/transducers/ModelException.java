// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

/** Invalid model configuration, e.g. an n-gram order below one. */
public class ModelException extends RuntimeException {

    private static final long serialVersionUID = -2369412271830356618L;

    public static enum Reason {
        INVALID_ORDER,
        INVALID_OPTION
    }

    private final Reason reason;

    public ModelException(Reason reason, String message) {
        super(reason + ": " + message);
        this.reason = reason;
    }

    public Reason getReason() { return reason; }
}
