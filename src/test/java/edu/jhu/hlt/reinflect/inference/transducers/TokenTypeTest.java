// Copyright (c) 2013, Johns Hopkins University. All rights reserved.
// This software is released under the 2-clause BSD license.
// See /LICENSE.txt

package edu.jhu.hlt.reinflect.inference.transducers;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class TokenTypeTest {

	@Test
	public void utf8SplitsCodePoints() {
		List<String> s = TokenType.UTF8.tokenize("a😀b");
		assertEquals(Arrays.asList("a", "😀", "b"), s);
		assertEquals("a😀b", TokenType.UTF8.join(s));
	}

	@Test
	public void spaceSplitsOnWhitespace() {
		List<String> s = TokenType.SPACE.tokenize(" k  æ\tt ");
		assertEquals(Arrays.asList("k", "æ", "t"), s);
		assertEquals("k æ t", TokenType.SPACE.join(s));
	}

	@Test
	public void fromName() {
		assertEquals(TokenType.UTF8, TokenType.fromName("utf8"));
		assertEquals(TokenType.SPACE, TokenType.fromName("SPACE"));
		try {
			TokenType.fromName("byte");
			fail("expected INVALID_OPTION");
		} catch(ModelException e) {
			assertEquals(ModelException.Reason.INVALID_OPTION, e.getReason());
		}
	}
}
