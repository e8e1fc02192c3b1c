package edu.isi.cfgtools;

import static edu.isi.cfgtools.Grammars.grammar;
import static edu.isi.cfgtools.Grammars.nt;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GrammarReaderTest {

	@Test
	void readsStartAlternativesAndComments() throws Exception {
		CFGRuleSet rs = grammar(
				"% a comment",
				"",
				"S    % the start",
				"S -> a S b | *e*   % trailing comment",
				"S -> T",
				"T -> t");
		assertEquals(nt("S"), rs.getStartState());
		assertEquals(4, rs.getNumRules());
		List<CFGRule> alts = rs.getRulesOfType(nt("S"));
		assertEquals("S -> a S b", alts.get(0).toString());
		assertTrue(alts.get(1).isEpsilonRule());
		assertTrue(alts.get(2).isUnitRule());
		assertEquals(3, rs.getNumTerminals());
	}

	@Test
	void nonterminalsAreTheLeftHandSides() throws Exception {
		CFGRuleSet rs = grammar(
				"S",
				"S -> A b",
				"A -> a");
		Symbol first = rs.getRulesOfType(nt("S")).get(0).getRHS().get(0);
		Symbol second = rs.getRulesOfType(nt("S")).get(0).getRHS().get(1);
		assertTrue(first.isNonterminal());
		assertTrue(second.isTerminal());
	}

	@Test
	void quotedTokensAreTerminals() throws Exception {
		CFGRuleSet rs = grammar(
				"S",
				"S -> \"S\" S | s");
		Symbol quoted = rs.getRulesOfType(nt("S")).get(0).getRHS().get(0);
		assertTrue(quoted.isTerminal());
		assertEquals("S", quoted.getName());
		assertFalse(rs.getRulesOfType(nt("S")).get(0).getRHS().get(1).isTerminal());
	}

	@Test
	void quotedTerminalsSurviveWritingAndReading() throws Exception {
		CFGRuleSet rs = grammar(
				"S",
				"S -> \"S\" a | b | \"*e*\"");
		assertEquals("S\nS -> \"S\" a\nS -> b\nS -> \"*e*\"\n", rs.toString());
		CFGRuleSet back = grammar(rs.toString().split("\n"));
		assertEquals(Grammars.ruleStrings(rs), Grammars.ruleStrings(back));
		assertEquals(Derivations.of("Sa", "b", "*e*"), Derivations.upTo(back, 4));

		CFGRuleSet folded = grammar(rs.toAlternativesString().split("\n"));
		assertEquals(Grammars.ruleStrings(rs), Grammars.ruleStrings(folded));
	}

	@Test
	void ruleLessNonterminalsDoNotComeBackAsTerminals() throws Exception {
		PDARuleSet p = Grammars.pda(
				"states p q",
				"input a",
				"stack Z Y",
				"start p",
				"bottom Z",
				"accept q",
				"p a Z -> q Y",
				"p a Y -> q *e*");
		CFGRuleSet g = PDAToCFG.convert(p, AcceptanceMode.EMPTY_STACK);
		CFGRuleSet back = grammar(g.toString().split("\n"));
		assertEquals(Derivations.upTo(g, 4), Derivations.upTo(back, 4));
		assertEquals(1, back.getNumTerminals());
		for (CFGRule r : back.getRules())
			for (Symbol s : r.getRHS())
				if (s.isTerminal())
					assertEquals("a", s.getName(), r.toString());

		CFGRuleSet folded = grammar(g.toAlternativesString().split("\n"));
		assertEquals(Grammars.ruleStrings(back), Grammars.ruleStrings(folded));
	}

	@Test
	void startWithoutRulesIsAllowed() throws Exception {
		CFGRuleSet rs = grammar("S");
		assertEquals(nt("S"), rs.getStartState());
		assertEquals(0, rs.getNumRules());
	}

	@Test
	void noStartIsAnError() {
		assertThrows(NoStartSymbolException.class, () -> grammar("% nothing here", ""));
	}

	@Test
	void epsilonAmongOtherSymbolsIsAnError() {
		assertThrows(MalformedEpsilonException.class, () -> grammar("S", "S -> a *e* b"));
	}

	@Test
	void epsilonOnTheLeftIsAnError() {
		assertThrows(MalformedEpsilonException.class, () -> grammar("S", "*e* -> a"));
	}

	@Test
	void emptyAlternativeIsAnError() {
		DataFormatException e = assertThrows(DataFormatException.class, () -> grammar("S", "S -> a | "));
		assertTrue(e.getMessage().contains("*e*"), e.getMessage());
		assertThrows(DataFormatException.class, () -> grammar("S", "S -> "));
	}

	@Test
	void linesWithoutArrowAreErrors() {
		assertThrows(DataFormatException.class, () -> grammar("S", "S a b"));
		assertThrows(DataFormatException.class, () -> grammar("S T", "S -> a"));
	}

	@Test
	void readsFromAFile(@TempDir Path dir) throws Exception {
		Path p = dir.resolve("g.cfg");
		Files.write(p, "S\nS -> é S | *e*\n".getBytes(StandardCharsets.UTF_8));
		CFGRuleSet rs = GrammarReader.read(new File(p.toString()), "utf-8");
		assertEquals("S -> é S", rs.getRules().get(0).toString());
	}
}
