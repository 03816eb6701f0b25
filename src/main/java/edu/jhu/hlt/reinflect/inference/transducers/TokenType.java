// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;

/**
 * How a raw string splits into atomic symbols.
 */
public enum TokenType {

    /** one symbol per Unicode code point */
    UTF8 {
        @Override
        public List<String> tokenize(String s) {
            List<String> res = new ArrayList<String>(s.length());
            for(int i=0; i<s.length(); ) {
                int cp = s.codePointAt(i);
                res.add(new String(Character.toChars(cp)));
                i += Character.charCount(cp);
            }
            return res;
        }

        @Override
        public String join(List<String> symbols) {
            return Joiner.on("").join(symbols);
        }
    },

    /** whitespace-separated symbols, e.g. phones */
    SPACE {
        private final Splitter splitter = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

        @Override
        public List<String> tokenize(String s) {
            return new ArrayList<String>(splitter.splitToList(s));
        }

        @Override
        public String join(List<String> symbols) {
            return Joiner.on(' ').join(symbols);
        }
    };

    public abstract List<String> tokenize(String s);

    public abstract String join(List<String> symbols);

    /** Parses "utf8" or "space" (case-insensitive). */
    public static TokenType fromName(String name) {
        for(TokenType t : values()) {
            if(t.name().equalsIgnoreCase(name)) return t;
        }
        throw new ModelException(ModelException.Reason.INVALID_OPTION,
                                 "unknown token type '" + name + "' (expected utf8 or space)");
    }
}
