package edu.isi.cfgtools;

import static edu.isi.cfgtools.Grammars.grammar;
import static edu.isi.cfgtools.Grammars.ruleStrings;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class NormalizerTest {

	private static List<CFGRuleSet> samples;

	@BeforeAll
	static void readSamples() throws Exception {
		samples = new ArrayList<CFGRuleSet>();
		samples.add(grammar(
				"S",
				"S -> a S b | *e*"));
		samples.add(grammar(
				"S",
				"S -> A B | C",
				"A -> a A | *e*",
				"B -> b B | *e*",
				"C -> C c",
				"D -> d"));
		samples.add(grammar(
				"E",
				"E -> E + T | T",
				"T -> T * F | F",
				"F -> ( E ) | x"));
		samples.add(grammar(
				"S",
				"S -> a T | *e*",
				"T -> S | b"));
		samples.add(grammar(
				"S",
				"S -> A",
				"A -> B",
				"B -> S | *e*"));
		samples.add(grammar(
				"S",
				"S -> S S | ( S ) | *e*"));
	}

	@Test
	void outputIsNormalized() {
		for (CFGRuleSet rs : samples) {
			CFGRuleSet out = new Normalizer().normalize(rs);
			assertTrue(out.isNormalized(), "not normalized:\n"+out);
			for (CFGRule r : out.getRules()) {
				if (r.isEpsilonRule())
					assertEquals(out.getStartState(), r.getLHS());
				assertFalse(r.isUnitRule(), r.toString());
			}
		}
	}

	@Test
	void normalizingTwiceChangesNothing() {
		Normalizer n = new Normalizer();
		for (CFGRuleSet rs : samples) {
			CFGRuleSet once = n.normalize(rs);
			CFGRuleSet twice = n.normalize(once);
			assertEquals(ruleStrings(once), ruleStrings(twice), rs.toString());
		}
	}

	@Test
	void languageIsPreserved() {
		for (CFGRuleSet rs : samples) {
			Set<String> before = Derivations.upTo(rs, 6);
			assertEquals(before, Derivations.upTo(rs.normalize(), 6), rs.toString());
		}
	}

	@Test
	void emptyStringCanBeDropped() {
		Normalizer n = new Normalizer(false);
		assertFalse(n.isKeepStartEpsilon());
		for (CFGRuleSet rs : samples) {
			CFGRuleSet out = n.normalize(rs);
			Set<String> expected = Derivations.upTo(rs, 6);
			expected.remove("");
			assertEquals(expected, Derivations.upTo(out, 6));
			for (CFGRule r : out.getRules())
				assertFalse(r.isEpsilonRule(), r.toString());
		}
	}

	@Test
	void sameInputSameOutput() throws Exception {
		CFGRuleSet a = samples.get(1).normalize();
		CFGRuleSet b = grammar(
				"S",
				"S -> A B | C",
				"A -> a A | *e*",
				"B -> b B | *e*",
				"C -> C c",
				"D -> d").normalize();
		assertEquals(a.toString(), b.toString());
	}

	@Test
	void epsilonOnlyGrammar() throws Exception {
		CFGRuleSet out = grammar(
				"S",
				"S -> A",
				"A -> *e*").normalize();
		assertEquals("S\nS -> *e*\n", out.toString());
	}
}
