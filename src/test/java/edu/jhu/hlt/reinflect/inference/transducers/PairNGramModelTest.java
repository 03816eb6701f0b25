// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

import static org.junit.Assert.*;

import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

public class PairNGramModelTest {

	static final String [] ALIGNED = {
		"c:c a:a t:t -:s",
		"d:d o:o g:g -:s",
		"w:w a:a l:l k:k -:e -:d",
		"t:t a:a l:l k:k -:e -:d",
		"s:s i:a n:n g:g",
		"r:r i:a n:n g:g",
		"b:b o:o x:x -:e -:s",
		"h:h e:-",
	};

	static AlignedCorpus corpus(SymbolTable symbols) {
		return Corpora.aligned(symbols, ALIGNED);
	}

	@Test
	public void everyStateSumsToOne() {
		for(int order=1; order<=5; order++) {
			PairNGramModel m = new PairNGramEstimator().train(corpus(new SymbolTable()), order);
			for(int s=0; s<m.numStates(); s++) {
				assertEquals("order " + order + ", state " + m.context(s), 1.0, m.totalProbability(s), 1e-9);
			}
		}
	}

	@Test
	public void fixedDiscountSumsToOne() {
		PairNGramModel m = new PairNGramEstimator(0.01).train(corpus(new SymbolTable()), 4);
		for(int s=0; s<m.numStates(); s++) {
			assertEquals(1.0, m.totalProbability(s), 1e-9);
		}
	}

	@Test
	public void everyPairHasFiniteCost() {
		PairNGramModel m = new PairNGramEstimator().train(corpus(new SymbolTable()), 3);
		for(int s=0; s<m.numStates(); s++) {
			assertFalse(Double.isInfinite(m.continuationWeight(s)));
			for(int label=1; label<=m.numPairs(); label++) {
				double c = m.score(s, label);
				assertTrue(c > 0 && !Double.isInfinite(c));
			}
		}
	}

	@Test
	public void unigramByHand() {
		SymbolTable symbols = new SymbolTable();
		AlignedCorpus c = Corpora.aligned(symbols, "a:a a:a");
		PairNGramModel m = new PairNGramEstimator(0.5).train(c, 1);
		assertEquals(1, m.numPairs());
		assertEquals(1, m.numStates());
		assertEquals(m.startState(), m.stateOf(NGramContext.START));
		// counts a:a = 2, EOS = 1; p = (c - 0.5) / 3 + (0.5 * 2 / 3) / 2
		assertEquals(-Math.log(2.0 / 3), m.score(NGramContext.EMPTY, Corpora.pair(symbols, "a:a")), 1e-12);
		assertEquals(-Math.log(1.0 / 3), m.continuationWeight(NGramContext.EMPTY), 1e-12);
	}

	@Test
	public void bigramByHand() {
		SymbolTable symbols = new SymbolTable();
		AlignedCorpus c = Corpora.aligned(symbols, "a:a b:b");
		PairNGramModel m = new PairNGramEstimator(0.5).train(c, 2);
		AlignedPair a = Corpora.pair(symbols, "a:a");
		AlignedPair b = Corpora.pair(symbols, "b:b");
		// unigram continuation counts: a, b and EOS once each, V = 3
		double pa = 0.5 / 3 + (0.5 * 3 / 3) / 3;
		assertEquals(-Math.log(pa), m.score(NGramContext.EMPTY, a), 1e-12);
		// after BOS only a was seen: (1 - 0.5) / 1 + 0.5 * p1(w)
		assertEquals(-Math.log(0.5 + 0.5 * pa), m.score(NGramContext.START, a), 1e-12);
		assertEquals(-Math.log(0.5 * pa), m.score(NGramContext.START, b), 1e-12);
		assertEquals(-Math.log(0.5 * pa), m.continuationWeight(NGramContext.START), 1e-12);
	}

	@Test
	public void statesAndTransitions() {
		SymbolTable symbols = new SymbolTable();
		PairNGramModel m = new PairNGramEstimator().train(corpus(symbols), 3);
		assertEquals(NGramContext.START, m.context(m.startState()));
		assertEquals(NGramContext.EMPTY, m.context(0));
		assertEquals(-1, m.backoffState(0));

		int c = m.labelOf(Corpora.pair(symbols, "c:c"));
		int a = m.labelOf(Corpora.pair(symbols, "a:a"));
		PairNGramModel.Transition t = m.transition(m.startState(), c);
		assertEquals(new NGramContext(new int[] { NGramContext.BOUNDARY, c }), m.context(t.nextState));
		PairNGramModel.Transition u = m.transition(t.nextState, a);
		assertEquals(new NGramContext(new int[] { c, a }), m.context(u.nextState));

		// histories longer than the order are truncated, unseen ones backed off
		int k = m.labelOf(Corpora.pair(symbols, "k:k"));
		assertEquals(u.nextState, m.stateOf(new NGramContext(new int[] { k, c, a })));
		assertEquals(m.stateOf(new NGramContext(new int[] { a })), m.stateOf(new NGramContext(new int[] { k, a })));

		assertNull(m.transition(m.startState(), m.numPairs() + 1));
		assertTrue(Double.isInfinite(m.score(NGramContext.START, Corpora.pair(symbols, "z:z"))));
	}

	@Test
	public void longestInsertionRun() {
		PairNGramModel m = new PairNGramEstimator().train(corpus(new SymbolTable()), 2);
		assertEquals(2, m.maxInsertionRun());
	}

	@Test
	public void invalidOrder() {
		try {
			new PairNGramEstimator().train(corpus(new SymbolTable()), 0);
			fail("expected INVALID_ORDER");
		} catch(ModelException e) {
			assertEquals(ModelException.Reason.INVALID_ORDER, e.getReason());
		}
	}

	@Test
	public void invalidDiscount() {
		for(double d : new double[] { 0.0, 1.0, 1.5 }) {
			try {
				new PairNGramEstimator(d);
				fail("expected INVALID_OPTION for " + d);
			} catch(ModelException e) {
				assertEquals(ModelException.Reason.INVALID_OPTION, e.getReason());
			}
		}
	}

	@Test
	public void singletonCountsKeepContext() {
		// every bigram is seen once, so there are no count-2 n-grams at the top order
		SymbolTable symbols = new SymbolTable();
		AlignedCorpus c = Corpora.aligned(symbols, "c:c -:a a:t t:s", "d:d -:o o:g g:s");
		PairNGramModel m = new PairNGramEstimator().train(c, 2);
		AlignedPair insertA = Corpora.pair(symbols, "-:a");
		NGramContext afterC = new NGramContext(new int[] { m.labelOf(Corpora.pair(symbols, "c:c")) });
		int s = m.stateOf(afterC);
		assertEquals(afterC, m.context(s));
		assertTrue(m.backoffWeight(s) > 0.0);
		assertTrue(m.score(afterC, insertA) < m.score(NGramContext.EMPTY, insertA));
		// (1 - 0.5) / 1 + 0.5 * p1(-:a)
		double p1 = Math.exp(-m.score(NGramContext.EMPTY, insertA));
		assertEquals(-Math.log(0.5 + 0.5 * p1), m.score(afterC, insertA), 1e-12);
	}

	@Test
	public void noNegativeZeroInArtifact() throws Exception {
		StringWriter w = new StringWriter();
		new PairNGramEstimator().train(corpus(new SymbolTable()), 3).write(w);
		assertFalse(w.toString().contains("-0.0\t"));
		assertFalse(w.toString().contains("\t-0.0\n"));
	}

	/** Replaces one tab-separated field of a state line. */
	static String corrupt(String model, int state, int field, String value) {
		StringBuilder sb = new StringBuilder();
		for(String line : model.split("\n")) {
			String [] f = line.split("\t");
			if(f[0].equals("state") && f[1].equals(Integer.toString(state))) {
				f[field] = value;
				line = String.join("\t", f);
			}
			sb.append(line).append('\n');
		}
		return sb.toString();
	}

	@Test
	public void readRejectsBadBackoffAndDuplicates() throws Exception {
		SymbolTable symbols = new SymbolTable();
		StringWriter w = new StringWriter();
		new PairNGramEstimator().train(Corpora.aligned(symbols, "a:a b:b"), 2).write(w);
		String good = w.toString();
		PairNGramModel.read(new StringReader(good));
		// states: 0 = empty, 1 = BOS, 2 = a:a, 3 = b:b
		String [] bad = {
			corrupt(good, 1, 3, "99"),
			corrupt(good, 1, 3, "-1"),
			corrupt(good, 2, 3, "3"),
			corrupt(good, 0, 3, "1"),
			corrupt(good, 3, 2, "1"),
		};
		for(String text : bad) {
			try {
				PairNGramModel.read(new StringReader(text));
				fail("expected MALFORMED_INPUT for\n" + text);
			} catch(DataException e) {
				assertEquals(DataException.Reason.MALFORMED_INPUT, e.getReason());
			}
		}
	}

	@Test
	public void emptyAlignedCorpus() {
		SymbolTable symbols = new SymbolTable();
		try {
			new PairNGramEstimator().train(AlignedCorpus.of(symbols, new ArrayList<List<AlignedPair>>()), 3);
			fail("expected EMPTY_ALIGNED_CORPUS");
		} catch(DataException e) {
			assertEquals(DataException.Reason.EMPTY_ALIGNED_CORPUS, e.getReason());
		}
	}

	@Test
	public void writeReadWrite() throws Exception {
		SymbolTable symbols = new SymbolTable();
		PairNGramModel m = new PairNGramEstimator().train(corpus(symbols), 4);
		StringWriter w1 = new StringWriter();
		m.write(w1);
		PairNGramModel r = PairNGramModel.read(new StringReader(w1.toString()));
		StringWriter w2 = new StringWriter();
		r.write(w2);
		assertEquals(w1.toString(), w2.toString());

		assertEquals(m.order(), r.order());
		assertEquals(m.symbolsFingerprint(), r.symbolsFingerprint());
		assertEquals(m.maxInsertionRun(), r.maxInsertionRun());
		assertEquals(m.pairs(), r.pairs());
		assertEquals(m.numStates(), r.numStates());
		assertEquals(m.startState(), r.startState());
		for(int s=0; s<m.numStates(); s++) {
			assertEquals(m.context(s), r.context(s));
			assertEquals(m.continuationWeight(s), r.continuationWeight(s), 0.0);
			for(int label=1; label<=m.numPairs(); label++) {
				assertEquals(m.score(s, label), r.score(s, label), 0.0);
				assertEquals(m.transition(s, label).nextState, r.transition(s, label).nextState);
			}
		}
	}

	@Test
	public void sameCorpusSameArtifact() throws Exception {
		StringWriter w1 = new StringWriter();
		StringWriter w2 = new StringWriter();
		new PairNGramEstimator().train(corpus(new SymbolTable()), 3).write(w1);
		new PairNGramEstimator().train(corpus(new SymbolTable()), 3).write(w2);
		assertEquals(w1.toString(), w2.toString());
	}

	@Test
	public void readRejectsGarbage() throws Exception {
		try {
			PairNGramModel.read(new StringReader("pairngram\t1\norder\tthree\n"));
			fail("expected MALFORMED_INPUT");
		} catch(DataException e) {
			assertEquals(DataException.Reason.MALFORMED_INPUT, e.getReason());
		}
		try {
			PairNGramModel.read(new StringReader("pairngram\t1\norder\t3\n"));
			fail("expected MALFORMED_INPUT");
		} catch(DataException e) {
			assertEquals(DataException.Reason.MALFORMED_INPUT, e.getReason());
		}
	}
}
