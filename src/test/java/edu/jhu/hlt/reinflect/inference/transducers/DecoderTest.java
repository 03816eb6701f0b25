// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

import static org.junit.Assert.*;

import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.Test;

public class DecoderTest {

	static PairNGramModel train(SymbolTable symbols, List<WordPair> corpus, int order, PairNGramEstimator estimator) {
		symbols.stopGrowth();
		PairAligner aligner = new PairAligner(symbols, Corpora.options(5, 2));
		AlignedCorpus aligned = aligner.align(corpus, aligner.train(corpus));
		return estimator.train(aligned, order);
	}

	static Decoder catsAndDogs(SymbolTable symbols) {
		List<WordPair> corpus = Corpora.pairs(symbols, "cat", "cats", "dog", "dogs");
		PairNGramModel model = train(symbols, corpus, 2, new PairNGramEstimator());
		return new Decoder(model, symbols, model.maxInsertionRun(), 2);
	}

	/** Model over a fixed alignment with estimated discounts. */
	static Decoder handAligned(SymbolTable symbols, String... aligned) {
		PairNGramModel model = new PairNGramEstimator().train(Corpora.aligned(symbols, aligned), 2);
		symbols.stopGrowth();
		return new Decoder(model, symbols, model.maxInsertionRun(), 1);
	}

	@Test
	public void catBecomesCatsUnderEitherAlignment() throws Exception {
		Decoder tidy = handAligned(new SymbolTable(), "c:c a:a t:t -:s", "d:d o:o g:g -:s");
		assertEquals(Corpora.chars("cats"), tidy.decode(Corpora.chars("cat")));
		assertEquals(Corpora.chars("dogs"), tidy.decode(Corpora.chars("dog")));

		Decoder shifted = handAligned(new SymbolTable(), "c:c -:a a:t t:s", "d:d -:o o:g g:s");
		assertEquals(Corpora.chars("cats"), shifted.decode(Corpora.chars("cat")));
		assertEquals(Corpora.chars("dogs"), shifted.decode(Corpora.chars("dog")));
	}

	@Test
	public void catBecomesCats() throws Exception {
		SymbolTable symbols = new SymbolTable();
		Decoder d = catsAndDogs(symbols);
		assertEquals(Corpora.chars("cats"), d.decode(Corpora.chars("cat")));
		assertEquals(Corpora.chars("dogs"), d.decode(Corpora.chars("dog")));
	}

	@Test
	public void unknownSymbolFails() {
		SymbolTable symbols = new SymbolTable();
		Decoder d = catsAndDogs(symbols);
		try {
			d.decode(Corpora.chars("cax"));
			fail("expected a decode failure");
		} catch(DecodeFailureException e) {
			assertEquals(DecodeFailureException.Reason.UNKNOWN_SYMBOL, e.getReason());
		}
	}

	@Test
	public void targetOnlySymbolHasNoPath() {
		SymbolTable symbols = new SymbolTable();
		Decoder d = catsAndDogs(symbols);
		try {
			d.decode(Corpora.chars("s"));
			fail("expected a decode failure");
		} catch(DecodeFailureException e) {
			assertEquals(DecodeFailureException.Reason.NO_PATH, e.getReason());
		}
	}

	@Test
	public void noInsertionsAllowed() throws Exception {
		SymbolTable symbols = new SymbolTable();
		Decoder full = handAligned(symbols, "c:c a:a t:t -:s", "d:d o:o g:g -:s");
		Decoder d = new Decoder(full.getModel(), symbols, 0, 1);
		assertEquals(Corpora.chars("cat"), d.decode(Corpora.chars("cat")));
	}

	@Test
	public void kBestIsDistinctAndOrdered() throws Exception {
		SymbolTable symbols = new SymbolTable();
		Decoder d = catsAndDogs(symbols);
		List<ScoredOutput> best = d.decode(Corpora.chars("cat"), 3);
		assertEquals(3, best.size());
		assertEquals(Corpora.chars("cats"), best.get(0).output());
		Set<List<String>> seen = new HashSet<List<String>>();
		for(int i=0; i<best.size(); i++) {
			assertTrue(seen.add(best.get(i).output()));
			if(i > 0) assertTrue(best.get(i - 1).cost() <= best.get(i).cost());
		}
		// the single best path is the cheapest of the list
		assertEquals(best.get(0).output(), d.decode(Corpora.chars("cat")));
		assertEquals(d.decode(Corpora.chars("cat"), 1).get(0).cost(), best.get(0).cost(), 0.0);
	}

	@Test
	public void pathCostMatchesModel() throws Exception {
		SymbolTable symbols = new SymbolTable();
		Decoder d = catsAndDogs(symbols);
		PairNGramModel m = d.getModel();
		ScoredOutput best = d.decode(Corpora.chars("cat"), 1).get(0);
		int state = m.startState();
		double cost = 0;
		for(AlignedPair p : best.path()) {
			PairNGramModel.Transition t = m.transition(state, m.labelOf(p));
			cost += t.cost;
			state = t.nextState;
		}
		cost += m.continuationWeight(state);
		assertEquals(cost, best.cost(), 1e-9);
	}

	@Test
	public void decodesItsOwnTrainingData() throws Exception {
		SymbolTable symbols = new SymbolTable();
		List<WordPair> corpus = Corpora.pairs(symbols, PairAlignerTest.WORDS);
		PairNGramModel model = train(symbols, corpus, 6, new PairNGramEstimator(0.01));
		Decoder d = new Decoder(model, symbols);
		for(int i=0; i<PairAlignerTest.WORDS.length; i+=2) {
			List<String> out = d.decode(Corpora.chars(PairAlignerTest.WORDS[i]));
			assertEquals(Corpora.chars(PairAlignerTest.WORDS[i + 1]), out);
		}
	}

	@Test
	public void batchKeepsOrderAndFailures() {
		SymbolTable symbols = new SymbolTable();
		Decoder d = catsAndDogs(symbols);
		List<List<String>> sources = new ArrayList<List<String>>();
		for(String w : Arrays.asList("dog", "cax", "cat", "s")) sources.add(Corpora.chars(w));
		List<DecodeResult> results = d.decodeAll(sources, 1);
		assertEquals(4, results.size());
		assertTrue(results.get(0).isSuccess());
		assertEquals(Corpora.chars("dogs"), results.get(0).best().output());
		assertFalse(results.get(1).isSuccess());
		assertEquals(DecodeFailureException.Reason.UNKNOWN_SYMBOL, results.get(1).failure().getReason());
		assertEquals(Corpora.chars("cats"), results.get(2).best().output());
		assertEquals(DecodeFailureException.Reason.NO_PATH, results.get(3).failure().getReason());
		for(int i=0; i<sources.size(); i++) {
			assertEquals(sources.get(i), results.get(i).source());
		}
	}

	@Test
	public void loadedModelDecodesTheSame() throws Exception {
		SymbolTable symbols = new SymbolTable();
		Decoder d = catsAndDogs(symbols);
		StringWriter model = new StringWriter();
		d.getModel().write(model);
		StringWriter table = new StringWriter();
		symbols.write(table);
		Decoder loaded = new Decoder(PairNGramModel.read(new StringReader(model.toString())),
				SymbolTable.read(new StringReader(table.toString())));
		for(String w : Arrays.asList("cat", "dog", "god", "tac")) {
			List<ScoredOutput> a = d.decode(Corpora.chars(w), 2);
			List<ScoredOutput> b = loaded.decode(Corpora.chars(w), 2);
			assertEquals(a.size(), b.size());
			for(int i=0; i<a.size(); i++) {
				assertEquals(a.get(i).output(), b.get(i).output());
				assertEquals(a.get(i).cost(), b.get(i).cost(), 0.0);
			}
		}
	}

	@Test
	public void otherSymbolTableIsRefused() {
		SymbolTable symbols = new SymbolTable();
		Decoder d = catsAndDogs(symbols);
		SymbolTable other = new SymbolTable();
		other.str2seq(Corpora.chars("tacdogs"));
		try {
			new Decoder(d.getModel(), other);
			fail("expected SYMBOL_TABLE_MISMATCH");
		} catch(DataException e) {
			assertEquals(DataException.Reason.SYMBOL_TABLE_MISMATCH, e.getReason());
		}
	}
}
