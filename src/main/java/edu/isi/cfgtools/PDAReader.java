package edu.isi.cfgtools;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// reads a pushdown automaton file:
//
//   % balanced parentheses, empty stack
//   states q
//   input ( )
//   stack Z X
//   start q
//   bottom Z
//   accept q
//   q ( Z -> q X Z
//   q ) X -> q *e*
//   q,(,X,q,XX
//
// transition lines are "state input top -> next push..." with *e* for an epsilon
// move or an empty push, or the comma form "state,input,top,next,push" in which
// push is a string of one-character stack symbols (ε or *e* for none). a line is
// tried as a transition before it is tried as a header, so a state may be named
// start or accept. when none of states, input and stack is declared, they are
// gathered from the transitions.
public class PDAReader {

	private PDAReader() {}

	private static Pattern commentPat = Pattern.compile("\\s*(%.*)?");
	private static Pattern commentStripPat = Pattern.compile("\\s*(.*?[^\\s%])(\\s*(?:%.*)?)?");
	private static Pattern headerPat = Pattern.compile("(states|input|stack|start|bottom|accept)\\b\\s*(.*)");
	private static Pattern arrowPat = Pattern.compile("(\\S+)\\s+(\\S+)\\s+(\\S+)\\s*->\\s*(\\S+)((?:\\s+\\S+)*)\\s*");
	private static Pattern commaPat = Pattern.compile("([^,\\s]+),([^,\\s]+),([^,\\s]+),([^,\\s]+),([^,\\s]*)");

	private static final String GREEK_EPSILON = "\u03b5";

	public static PDARuleSet read(File f, String encoding) throws IOException, DataFormatException {
		BufferedReader br = new BufferedReader(new InputStreamReader(new FileInputStream(f), encoding));
		try {
			return read(br);
		}
		finally {
			br.close();
		}
	}

	public static PDARuleSet read(BufferedReader br) throws IOException, DataFormatException {
		boolean debug = false;
		PDARuleSet.Builder b = new PDARuleSet.Builder();
		boolean declared = false;
		int lineno = 0;
		String line;
		while ((line = br.readLine()) != null) {
			lineno++;
			if (commentPat.matcher(line).matches())
				continue;
			Matcher commentStripMatch = commentStripPat.matcher(line);
			if (!commentStripMatch.matches())
				throw new DataFormatException("line "+lineno+": couldn't strip comments off of "+line);
			String text = commentStripMatch.group(1);

			Matcher arrowMatch = arrowPat.matcher(text);
			if (arrowMatch.matches()) {
				List<String> push = new ArrayList<String>();
				String[] ys = split(arrowMatch.group(5));
				if (!(ys.length == 1 && isEpsilon(ys[0]))) {
					for (String y : ys) {
						if (isEpsilon(y))
							throw new MalformedEpsilonException("line "+lineno+": "+text);
						push.add(y);
					}
				}
				b.addTransition(makeTransition(arrowMatch.group(1), arrowMatch.group(2), arrowMatch.group(3),
						arrowMatch.group(4), push));
				continue;
			}

			Matcher commaMatch = commaPat.matcher(text);
			if (commaMatch.matches()) {
				List<String> push = new ArrayList<String>();
				String ys = commaMatch.group(5);
				if (!isEpsilon(ys) && ys.length() > 0) {
					for (int i = 0; i < ys.length(); i++)
						push.add(ys.substring(i, i+1));
				}
				b.addTransition(makeTransition(commaMatch.group(1), commaMatch.group(2), commaMatch.group(3),
						commaMatch.group(4), push));
				continue;
			}

			Matcher headerMatch = headerPat.matcher(text);
			if (headerMatch.matches()) {
				String key = headerMatch.group(1);
				String[] vals = split(headerMatch.group(2));
				if (debug) Debug.debug(debug, "header "+key+" with "+vals.length+" values");
				if (key.equals("states")) {
					declared = true;
					for (String v : vals)
						b.addState(v);
				}
				else if (key.equals("input")) {
					declared = true;
					for (String v : vals) {
						if (isEpsilon(v))
							throw new MalformedEpsilonException("line "+lineno+": epsilon is not an input symbol");
						b.addInputSymbol(v);
					}
				}
				else if (key.equals("stack")) {
					declared = true;
					for (String v : vals)
						b.addStackSymbol(v);
				}
				else if (key.equals("accept")) {
					for (String v : vals)
						b.addAcceptingState(v);
				}
				else {
					if (vals.length != 1)
						throw new DataFormatException("line "+lineno+": "+key+" takes exactly one name, but read "+text);
					if (key.equals("start"))
						b.setStartState(vals[0]);
					else
						b.setStartStack(vals[0]);
				}
				continue;
			}
			throw new DataFormatException("line "+lineno+": expected a header or a transition, but read "+line);
		}
		if (!declared) {
			if (debug) Debug.debug(debug, "no alphabets declared; inferring them");
			b.inferAlphabets();
		}
		return b.build();
	}

	private static PDATransition makeTransition(String p, String a, String x, String q, List<String> push) {
		Symbol in = isEpsilon(a) ? Symbol.getEpsilon() : SymbolFactory.getTerminal(a);
		return new PDATransition(p, in, x, q, push);
	}

	private static boolean isEpsilon(String s) {
		return s.equals(Symbol.EPSILON_STRING) || s.equals(GREEK_EPSILON);
	}

	private static String[] split(String s) {
		String t = s.trim();
		if (t.length() == 0)
			return new String[0];
		return t.split("\\s+");
	}
}
