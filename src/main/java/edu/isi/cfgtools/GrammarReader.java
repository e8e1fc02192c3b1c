package edu.isi.cfgtools;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// reads a grammar file:
//
//   % comment
//   S
//   S -> a S b | *e*
//   S -> "S"
//
// the first line that is not blank or a comment names the start nonterminal.
// every other line is an lhs, an arrow, and alternatives separated by |.
// nonterminals are the start and the lhs symbols; every other token is a
// terminal, as is anything in double quotes. *e* alone is the epsilon alternative.
public class GrammarReader {

	private GrammarReader() {}

	private static Pattern commentPat = Pattern.compile("\\s*(%.*)?");
	// start is a single token
	private static Pattern startStatePat = Pattern.compile("\\s*(\\S+)\\s*(%.*)?");
	// strip comments and surrounding whitespace
	private static Pattern commentStripPat = Pattern.compile("\\s*(.*?[^\\s%])(\\s*(?:%.*)?)?");
	// separate left from right
	private static Pattern sidesPat = Pattern.compile("(\\S+)\\s*->\\s*(.*)");

	// a rule line held until every lhs is known
	private static class RuleLine {
		final int lineno;
		final String lhs;
		final String rhs;
		RuleLine(int n, String l, String r) { lineno = n; lhs = l; rhs = r; }
	}

	public static CFGRuleSet read(File f, String encoding) throws IOException, DataFormatException {
		BufferedReader br = new BufferedReader(new InputStreamReader(new FileInputStream(f), encoding));
		try {
			return read(br);
		}
		finally {
			br.close();
		}
	}

	public static CFGRuleSet read(BufferedReader br) throws IOException, DataFormatException {
		boolean debug = false;
		String startName = null;
		int startLine = 0;
		List<RuleLine> ruleLines = new ArrayList<RuleLine>();
		HashSet<String> lhsNames = new HashSet<String>();
		int lineno = 0;
		String line;
		while ((line = br.readLine()) != null) {
			lineno++;
			if (commentPat.matcher(line).matches()) {
				if (debug) Debug.debug(debug, "Ignoring comment/whitespace: "+line);
				continue;
			}
			if (startName == null) {
				Matcher startStateMatch = startStatePat.matcher(line);
				if (!startStateMatch.matches())
					throw new DataFormatException("line "+lineno+": expected the start nonterminal, but read "+line);
				startName = startStateMatch.group(1);
				startLine = lineno;
				if (debug) Debug.debug(debug, "Start is "+startName);
				continue;
			}
			Matcher commentStripMatch = commentStripPat.matcher(line);
			if (!commentStripMatch.matches())
				throw new DataFormatException("line "+lineno+": couldn't strip comments off of "+line);
			Matcher sidesMatch = sidesPat.matcher(commentStripMatch.group(1));
			if (!sidesMatch.matches())
				throw new DataFormatException("line "+lineno+": incorrect rule format: "+line);
			if (sidesMatch.group(1).equals(Symbol.EPSILON_STRING))
				throw new MalformedEpsilonException("line "+lineno+": "+line);
			lhsNames.add(sidesMatch.group(1));
			ruleLines.add(new RuleLine(lineno, sidesMatch.group(1), sidesMatch.group(2)));
		}
		if (startName == null)
			throw new NoStartSymbolException("start nonterminal");
		if (startName.equals(Symbol.EPSILON_STRING))
			throw new MalformedEpsilonException("line "+startLine+": start "+startName);
		lhsNames.add(startName);

		CFGRuleSet.Builder b = new CFGRuleSet.Builder();
		NonterminalSymbol start = SymbolFactory.getNonterminal(startName);
		b.addState(start);
		for (RuleLine rl : ruleLines)
			b.addState(rl.lhs);
		b.addStartState(start);
		for (RuleLine rl : ruleLines) {
			NonterminalSymbol lhs = SymbolFactory.getNonterminal(rl.lhs);
			String rhsText = rl.rhs;
			if (rhsText.trim().length() == 0)
				throw new DataFormatException("line "+rl.lineno+": RHS appears to be empty in "+rl.lhs+" -> ");
			for (String alt : rhsText.split("\\|", -1)) {
				String[] toks = alt.trim().split("\\s+");
				if (alt.trim().length() == 0)
					throw new DataFormatException("line "+rl.lineno+": empty alternative in "+rl.lhs+" -> "+rhsText+
							"; write "+Symbol.EPSILON_STRING+" for epsilon");
				List<Symbol> rhs = new ArrayList<Symbol>();
				for (String tok : toks)
					rhs.add(SymbolFactory.getSymbol(tok, lhsNames));
				CFGRule r = new CFGRule(lhs, rhs);
				if (debug) Debug.debug(debug, "Made rule "+r);
				b.addRule(r);
			}
		}
		return b.build();
	}
}
