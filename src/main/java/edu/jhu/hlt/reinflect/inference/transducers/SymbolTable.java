// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Charsets;
import com.google.common.collect.BiMap;
import com.google.common.collect.HashBiMap;
import com.google.common.hash.Hashing;

/**
 * Bidirectional map between atomic symbols (characters or phones) and dense
 * integer IDs for one language. The null marker {@link #EPSILON} is always
 * ID 0. The table grows while the corpus is read, then {@link #stopGrowth()}
 * freezes it for training and decoding.
 */
public class SymbolTable {

    public static final String EPSILON = "<epsilon>";
    public static final int EPSILON_ID = 0;

    private final BiMap<String, Integer> index = HashBiMap.create();
    private final List<String> symbols = new ArrayList<String>();
    private boolean growing = true;

    public SymbolTable() {
        index.put(EPSILON, EPSILON_ID);
        symbols.add(EPSILON);
    }

    /**
     * Returns the ID of the symbol, adding it if the table is still growing.
     * Interning the same symbol twice returns the same ID.
     */
    public int intern(String symbol) {
        Integer id = index.get(symbol);
        if(id != null) return id;
        if(!growing)
            throw new DataException(DataException.Reason.UNKNOWN_SYMBOL,
                                    "symbol table is frozen; cannot add '" + symbol + "'");
        if(symbol.isEmpty() || symbol.indexOf('\t') >= 0 || symbol.indexOf('\n') >= 0)
            throw new DataException(DataException.Reason.MALFORMED_INPUT,
                                    "not an atomic symbol: '" + symbol + "'");
        id = symbols.size();
        index.put(symbol, id);
        symbols.add(symbol);
        return id;
    }

    /** ID of the symbol, or -1 if the table has never seen it. */
    public int indexOf(String symbol) {
        Integer id = index.get(symbol);
        return id == null ? -1 : id;
    }

    public String lookup(int id) {
        if(id < 0 || id >= symbols.size())
            throw new DataException(DataException.Reason.UNKNOWN_ID,
                                    "no symbol with ID " + id + " (table size " + symbols.size() + ")");
        return symbols.get(id);
    }

    public int size() { return symbols.size(); }

    public void stopGrowth() { growing = false; }

    public boolean isGrowing() { return growing; }

    public int [] str2seq(List<String> seq) {
        int [] res = new int[seq.size()];
        for(int i=0; i<res.length; i++) {
            res[i] = intern(seq.get(i));
        }
        return res;
    }

    public List<String> seq2str(int [] x) {
        List<String> res = new ArrayList<String>(x.length);
        for(int i=0; i<x.length; i++) {
            res.add(lookup(x[i]));
        }
        return res;
    }

    /** One "symbol TAB id" line per symbol, in ID order. */
    public void write(Writer out) throws IOException {
        for(int id=0; id<symbols.size(); id++) {
            out.write(symbols.get(id));
            out.write('\t');
            out.write(Integer.toString(id));
            out.write('\n');
        }
        out.flush();
    }

    /** Reads a table written by {@link #write}. The result is frozen. */
    public static SymbolTable read(Reader in) throws IOException {
        SymbolTable table = new SymbolTable();
        BufferedReader reader = new BufferedReader(in);
        String line;
        int lineno = 0;
        while((line = reader.readLine()) != null) {
            lineno++;
            if(line.isEmpty()) continue;
            int tab = line.lastIndexOf('\t');
            if(tab <= 0)
                throw new DataException(DataException.Reason.MALFORMED_INPUT,
                                        "symbol table line " + lineno + ": expected 'symbol<TAB>id'");
            String symbol = line.substring(0, tab);
            int id;
            try {
                id = Integer.parseInt(line.substring(tab + 1).trim());
            } catch(NumberFormatException e) {
                throw new DataException(DataException.Reason.MALFORMED_INPUT,
                                        "symbol table line " + lineno + ": bad ID", e);
            }
            if(id == EPSILON_ID) {
                if(!symbol.equals(EPSILON))
                    throw new DataException(DataException.Reason.MALFORMED_INPUT,
                                            "ID 0 is reserved for " + EPSILON + ", found '" + symbol + "'");
                continue;
            }
            if(id != table.size())
                throw new DataException(DataException.Reason.MALFORMED_INPUT,
                                        "symbol table line " + lineno + ": IDs are not dense (expected "
                                        + table.size() + ", found " + id + ")");
            table.intern(symbol);
        }
        table.stopGrowth();
        return table;
    }

    /** SHA-256 of the written table; identifies the ID assignment. */
    public String fingerprint() {
        StringWriter sw = new StringWriter();
        try {
            write(sw);
        } catch(IOException e) {
            throw new IllegalStateException(e);
        }
        return Hashing.sha256().hashString(sw.toString(), Charsets.UTF_8).toString();
    }

    @Override
    public String toString() {
        return "SymbolTable(" + symbols.size() + " symbols" + (growing ? "" : ", frozen") + ")";
    }
}
