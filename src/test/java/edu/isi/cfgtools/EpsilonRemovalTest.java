package edu.isi.cfgtools;

import static edu.isi.cfgtools.Grammars.grammar;
import static edu.isi.cfgtools.Grammars.nt;
import static edu.isi.cfgtools.Grammars.ruleStrings;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

class EpsilonRemovalTest {

	@Test
	void nullableWithoutADirectEpsilonRule() throws Exception {
		CFGRuleSet rs = grammar(
				"A",
				"A -> B C",
				"B -> *e*",
				"C -> *e*");
		Set<NonterminalSymbol> nullable = EpsilonRemoval.getNullableStates(rs);
		assertEquals(new HashSet<NonterminalSymbol>(Arrays.asList(nt("A"), nt("B"), nt("C"))), nullable);

		Set<String> rules = ruleStrings(EpsilonRemoval.removeEpsilons(rs));
		assertEquals(new HashSet<String>(Arrays.asList("A -> B C", "A -> B", "A -> C", "A -> *e*")), rules);

		Set<String> dropped = ruleStrings(EpsilonRemoval.removeEpsilons(rs, false));
		assertEquals(new HashSet<String>(Arrays.asList("A -> B C", "A -> B", "A -> C")), dropped);
	}

	@Test
	void nullabilityFollowsLongChains() throws Exception {
		CFGRuleSet rs = grammar(
				"S",
				"S -> A s",
				"A -> B",
				"B -> C C",
				"C -> D | c",
				"D -> *e*");
		Set<NonterminalSymbol> nullable = rs.getNullableStates();
		assertTrue(nullable.containsAll(Arrays.asList(nt("A"), nt("B"), nt("C"), nt("D"))));
		assertFalse(nullable.contains(nt("S")));
	}

	@Test
	void everyDeletionVariantIsProduced() throws Exception {
		CFGRuleSet rs = grammar(
				"S",
				"S -> a N b N c",
				"N -> n | *e*");
		CFGRuleSet out = rs.removeEpsilons();
		assertEquals(new HashSet<String>(Arrays.asList(
				"S -> a N b N c", "S -> a N b c", "S -> a b N c", "S -> a b c", "N -> n")), ruleStrings(out));
		// the unchanged alternative comes first
		assertEquals("S -> a N b N c", out.getRulesOfType(nt("S")).get(0).toString());
	}

	@Test
	void startKeepsItsEpsilonOnlyWhenAsked() throws Exception {
		CFGRuleSet rs = grammar(
				"S",
				"S -> a S b | *e*");
		CFGRuleSet kept = rs.removeEpsilons(true);
		assertEquals(new HashSet<String>(Arrays.asList("S -> a S b", "S -> a b", "S -> *e*")), ruleStrings(kept));
		assertTrue(kept.isEpsilonFree());
		assertEquals(Derivations.upTo(rs, 6), Derivations.upTo(kept, 6));

		CFGRuleSet dropped = rs.removeEpsilons(false);
		assertFalse(ruleStrings(dropped).contains("S -> *e*"));
		Set<String> expected = Derivations.upTo(rs, 6);
		expected.remove("");
		assertEquals(expected, Derivations.upTo(dropped, 6));
	}

	@Test
	void nonNullableStartGetsNoEpsilon() throws Exception {
		CFGRuleSet rs = grammar(
				"S",
				"S -> A x",
				"A -> *e* | a");
		CFGRuleSet out = rs.removeEpsilons();
		assertEquals(new HashSet<String>(Arrays.asList("S -> A x", "S -> x", "A -> a")), ruleStrings(out));
		assertEquals(Derivations.of("x", "ax"), Derivations.upTo(out, 3));
	}

	@Test
	void inputIsLeftUnchanged() throws Exception {
		CFGRuleSet rs = grammar(
				"S",
				"S -> a | *e*");
		String before = rs.toString();
		rs.removeEpsilons(false);
		assertEquals(before, rs.toString());
	}
}
