package edu.isi.cfgtools;

import static edu.isi.cfgtools.Grammars.grammar;
import static edu.isi.cfgtools.Grammars.nt;
import static edu.isi.cfgtools.Grammars.ruleStrings;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

class UnitRemovalTest {

	@Test
	void chainsResolveInOneCall() throws Exception {
		CFGRuleSet rs = grammar(
				"A",
				"A -> B",
				"B -> C",
				"C -> d");
		CFGRuleSet out = UnitRemoval.removeUnits(rs);
		assertEquals(new HashSet<String>(Arrays.asList("A -> d", "B -> d", "C -> d")), ruleStrings(out));
		assertTrue(out.isUnitFree());
	}

	@Test
	void closureIsReflexiveAndTransitive() throws Exception {
		CFGRuleSet rs = grammar(
				"A",
				"A -> B | a",
				"B -> C",
				"C -> c",
				"D -> A");
		Map<NonterminalSymbol, Set<NonterminalSymbol>> closure = UnitRemoval.getUnitClosure(rs);
		assertEquals(new HashSet<NonterminalSymbol>(Arrays.asList(nt("A"), nt("B"), nt("C"))), closure.get(nt("A")));
		assertEquals(new HashSet<NonterminalSymbol>(Arrays.asList(nt("C"))), closure.get(nt("C")));
		assertEquals(4, closure.get(nt("D")).size());
		// a nonterminal comes first in its own set
		assertEquals(nt("D"), closure.get(nt("D")).iterator().next());
	}

	@Test
	void cyclesTerminate() throws Exception {
		CFGRuleSet rs = grammar(
				"A",
				"A -> B | a",
				"B -> A | b");
		CFGRuleSet out = rs.removeUnits();
		assertEquals(new HashSet<String>(Arrays.asList("A -> a", "A -> b", "B -> b", "B -> a")), ruleStrings(out));
		assertEquals(Derivations.of("a", "b"), Derivations.upTo(out, 3));
	}

	@Test
	void ownAlternativesComeFirst() throws Exception {
		CFGRuleSet rs = grammar(
				"S",
				"S -> T | s S",
				"T -> t");
		CFGRuleSet out = rs.removeUnits();
		assertEquals("S -> s S", out.getRulesOfType(nt("S")).get(0).toString());
		assertEquals("S -> t", out.getRulesOfType(nt("S")).get(1).toString());
	}

	@Test
	void startEpsilonIsNotInherited() throws Exception {
		CFGRuleSet rs = grammar(
				"S",
				"S -> a T | *e*",
				"T -> S | b");
		CFGRuleSet out = rs.removeEpsilons().removeUnits();
		assertTrue(out.isEpsilonFree());
		assertTrue(out.isUnitFree());
		assertTrue(ruleStrings(out).contains("S -> *e*"));
		assertEquals(Derivations.upTo(rs, 5), Derivations.upTo(out, 5));
	}

	@Test
	void languageIsPreserved() throws Exception {
		CFGRuleSet rs = grammar(
				"E",
				"E -> E + T | T",
				"T -> T * F | F",
				"F -> ( E ) | x");
		CFGRuleSet out = rs.removeUnits();
		assertTrue(out.isUnitFree());
		assertEquals(Derivations.upTo(rs, 7), Derivations.upTo(out, 7));
	}
}
