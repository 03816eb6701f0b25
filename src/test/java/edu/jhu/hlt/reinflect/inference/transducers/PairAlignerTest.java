// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

import static org.junit.Assert.*;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import com.google.common.primitives.Ints;

public class PairAlignerTest {

	static final String [] WORDS = {
		"cat", "cats",
		"dog", "dogs",
		"walk", "walked",
		"talk", "talked",
		"sing", "sang",
		"ring", "rang",
		"box", "boxes",
	};

	@Test
	public void probabilitiesSumToOne() {
		SymbolTable symbols = new SymbolTable();
		List<WordPair> corpus = Corpora.pairs(symbols, WORDS);
		symbols.stopGrowth();
		AlignmentModel model = new PairAligner(symbols, Corpora.options(3, 2)).train(corpus);
		assertEquals(1.0, model.totalProbability(), 1e-6);
		for(int k=0; k<model.size(); k++) {
			assertTrue(model.probability(k) >= 0);
			assertFalse(model.pair(k).sourceLength() == 0 && model.pair(k).targetLength() == 0);
		}
	}

	@Test
	public void likelihoodNeverDecreases() {
		SymbolTable symbols = new SymbolTable();
		List<WordPair> corpus = Corpora.pairs(symbols, WORDS);
		symbols.stopGrowth();
		AlignerOptions opts = Corpora.options(1, 1);
		opts.maxIterations = 30;
		opts.delta = 0;
		AlignmentModel model = new PairAligner(symbols, opts).train(corpus);
		double [] ll = model.likelihoodHistory();
		assertTrue(ll.length > 1);
		for(int i=1; i<ll.length; i++) {
			assertTrue("iteration " + i + ": " + ll[i - 1] + " -> " + ll[i],
					ll[i] >= ll[i - 1] - 1e-8 * Math.abs(ll[i - 1]));
		}
	}

	@Test
	public void multiSymbolPairs() {
		SymbolTable symbols = new SymbolTable();
		List<WordPair> corpus = Corpora.pairs(symbols, WORDS);
		symbols.stopGrowth();
		AlignerOptions opts = Corpora.options(2, 2);
		opts.maxSourceLength = 2;
		opts.maxTargetLength = 2;
		PairAligner aligner = new PairAligner(symbols, opts);
		AlignmentModel model = aligner.train(corpus);
		assertEquals(1.0, model.totalProbability(), 1e-6);
		assertTrue(model.indexOf(Corpora.pair(symbols, "x:xe")) >= 0);
		assertReconstructs(corpus, aligner.align(corpus, model));
	}

	@Test
	public void sameSeedSameModel() throws Exception {
		SymbolTable symbols = new SymbolTable();
		List<WordPair> corpus = Corpora.pairs(symbols, WORDS);
		symbols.stopGrowth();
		AlignmentModel m1 = new PairAligner(symbols, Corpora.options(3, 1)).train(corpus);
		AlignmentModel m2 = new PairAligner(symbols, Corpora.options(3, 4)).train(corpus);
		StringWriter w1 = new StringWriter();
		StringWriter w2 = new StringWriter();
		m1.write(w1, symbols);
		m2.write(w2, symbols);
		assertEquals(w1.toString(), w2.toString());
		assertArrayEquals(m1.likelihoodHistory(), m2.likelihoodHistory(), 0.0);
	}

	@Test
	public void restartsUseDifferentStreams() {
		SymbolTable symbols = new SymbolTable();
		List<WordPair> corpus = Corpora.pairs(symbols, WORDS);
		symbols.stopGrowth();
		AlignmentModel one = new PairAligner(symbols, Corpora.options(1, 1)).train(corpus);
		AlignmentModel best = new PairAligner(symbols, Corpora.options(4, 1)).train(corpus);
		// restart 0 is shared, so more restarts can only help
		assertTrue(best.logLikelihood() >= one.logLikelihood());
	}

	@Test
	public void viterbiReconstructsEveryPair() {
		SymbolTable symbols = new SymbolTable();
		List<WordPair> corpus = Corpora.pairs(symbols, WORDS);
		symbols.stopGrowth();
		PairAligner aligner = new PairAligner(symbols, Corpora.options(2, 2));
		AlignedCorpus aligned = aligner.align(corpus, aligner.train(corpus));
		assertEquals(corpus.size(), aligned.size());
		assertEquals(0, aligned.failures());
		assertReconstructs(corpus, aligned);
	}

	@Test
	public void identityPairsWin() {
		SymbolTable symbols = new SymbolTable();
		List<WordPair> corpus = Corpora.pairs(symbols, WORDS);
		symbols.stopGrowth();
		PairAligner aligner = new PairAligner(symbols, Corpora.options(5, 2));
		AlignedCorpus aligned = aligner.align(corpus, aligner.train(corpus));
		List<AlignedPair> cats = aligned.get(0);
		assertEquals(Corpora.pair(symbols, "c:c"), cats.get(0));
		assertEquals(Corpora.pair(symbols, "a:a"), cats.get(1));
	}

	@Test
	public void emptyCorpus() {
		try {
			new PairAligner(new SymbolTable(), Corpora.options(1, 1)).train(new ArrayList<WordPair>());
			fail("expected EMPTY_CORPUS");
		} catch(DataException e) {
			assertEquals(DataException.Reason.EMPTY_CORPUS, e.getReason());
		}
	}

	@Test
	public void uninternedIdIsRejected() {
		SymbolTable symbols = new SymbolTable();
		List<WordPair> corpus = Corpora.pairs(symbols, "ab", "ab");
		corpus.add(new WordPair(new int[] { 1, 99 }, new int[] { 1 }));
		try {
			new PairAligner(symbols, Corpora.options(1, 1)).train(corpus);
			fail("expected UNKNOWN_SYMBOL");
		} catch(DataException e) {
			assertEquals(DataException.Reason.UNKNOWN_SYMBOL, e.getReason());
		}
	}

	@Test
	public void unalignableCorpusIsFatal() {
		SymbolTable symbols = new SymbolTable();
		List<WordPair> corpus = Corpora.pairs(symbols, "cat", "cats", "dog", "dogs");
		AlignerOptions opts = Corpora.options(1, 1);
		opts.sourceEpsilon = false;
		opts.targetEpsilon = false;
		try {
			new PairAligner(symbols, opts).train(corpus);
			fail("expected DEGENERATE_ALIGNMENT");
		} catch(DataException e) {
			assertEquals(DataException.Reason.DEGENERATE_ALIGNMENT, e.getReason());
		}
	}

	@Test
	public void fewFailuresAreCountedAndSkipped() {
		SymbolTable symbols = new SymbolTable();
		List<WordPair> corpus = Corpora.pairs(symbols, "cat", "kat", "dog", "dag", "bat", "bot", "cat", "cats");
		AlignerOptions opts = Corpora.options(1, 1);
		opts.sourceEpsilon = false;
		opts.targetEpsilon = false;
		opts.maxFailureFraction = 0.5;
		PairAligner aligner = new PairAligner(symbols, opts);
		AlignmentModel model = aligner.train(corpus);
		assertEquals(1.0, model.totalProbability(), 1e-6);
		AlignedCorpus aligned = aligner.align(corpus, model);
		assertEquals(3, aligned.size());
		assertEquals(1, aligned.failures());
		assertEquals(2, aligned.exampleIndex(2));
	}

	@Test
	public void invalidOptions() {
		AlignerOptions opts = Corpora.options(1, 1);
		opts.maxSourceLength = 3;
		try {
			new PairAligner(new SymbolTable(), opts);
			fail("expected INVALID_OPTION");
		} catch(ModelException e) {
			assertEquals(ModelException.Reason.INVALID_OPTION, e.getReason());
		}
	}

	@Test
	public void alignedCorpusText() throws Exception {
		SymbolTable symbols = new SymbolTable();
		AlignedCorpus aligned = Corpora.aligned(symbols, "c:c a:a t:t -:s");
		StringWriter sw = new StringWriter();
		aligned.write(sw);
		assertEquals("c:c a:a t:t <epsilon>:s\n", sw.toString());
	}

	static void assertReconstructs(List<WordPair> corpus, AlignedCorpus aligned) {
		for(int i=0; i<aligned.size(); i++) {
			WordPair p = corpus.get(aligned.exampleIndex(i));
			List<Integer> src = new ArrayList<Integer>();
			List<Integer> tgt = new ArrayList<Integer>();
			for(AlignedPair ap : aligned.get(i)) {
				for(int id : ap.source()) src.add(id);
				for(int id : ap.target()) tgt.add(id);
			}
			assertEquals(Ints.asList(p.source()), src);
			assertEquals(Ints.asList(p.target()), tgt);
		}
	}
}
