package edu.isi.cfgtools;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.Date;
import java.util.Iterator;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.EnumeratedStringParser;
import com.martiansoftware.jsap.stringparsers.FileStringParser;
import com.martiansoftware.jsap.stringparsers.IntegerStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

// command line options, etc.
public class CfgTools {
	// version number. change this when updating cfgtools!
	static final String VERSION = "1.0";

	// what to do with the input file
	public enum XF { NORMALIZE, CONVERT ;
	private static final String list;
	public static final String getList() { return list;}
	static {
		StringBuffer sb = new StringBuffer();
		for (XF x: XF.values()) {
			sb.append(x.toString().toLowerCase()+" ");
		}
		list = sb.toString();
	}
	public static XF get(String s) throws ConfigureException{
		for (XF x : XF.values()) {
			if (x.toString().equalsIgnoreCase(s))
				return x;
		}
		throw new ConfigureException("Invalid xform type ("+s+"); valid values are "+list);
	}
	}

	// summary of a grammar, added to a buffer
	static void getRuleSetCheck(StringBuffer buffer, String name, CFGRuleSet rs) {
		buffer.append("CFG info for "+name+":\n");
		buffer.append("\t"+rs.getNumStates()+" nonterminals\n");
		buffer.append("\t"+rs.getNumRules()+" rules\n");
		buffer.append("\t"+rs.getNumTerminals()+" unique terminal symbols\n");
		buffer.append("\t"+rs.getNullableStates().size()+" nullable nonterminals\n");
		buffer.append("\t"+(rs.isEpsilonFree() ? "no" : "has")+" epsilon rules outside the start\n");
		buffer.append("\t"+(rs.isUnitFree() ? "no" : "has")+" unit rules\n");
		buffer.append("\t"+(rs.isAllUseful() ? "no" : "has")+" useless nonterminals\n");
	}

	// summary of an automaton, added to a buffer
	static void getPDACheck(StringBuffer buffer, String name, PDARuleSet pda) {
		buffer.append("PDA info for "+name+":\n");
		buffer.append("\t"+pda.getNumStates()+" states\n");
		buffer.append("\t"+pda.getStackAlphabet().size()+" stack symbols\n");
		buffer.append("\t"+pda.getInputAlphabet().size()+" input symbols\n");
		buffer.append("\t"+pda.getNumTransitions()+" transitions\n");
		buffer.append("\t"+pda.getAcceptingStates().size()+" accepting states\n");
	}

	// everything having to do with the JSAP parameters and config exceptions based on this.
	// Sets the jsap object
	static JSAPResult processParameters(JSAP jsap, String[] argv) throws ConfigureException, JSAPException {

		// HELP OPTION
		Switch helpsw = new Switch("help",
				'h',
				"help",
		"print this help message");
		jsap.registerParameter(helpsw);

		// format of the input (and output data) - assumed utf-8 but can be changed here
		FlaggedOption encodingopt = new FlaggedOption("encoding",
				StringStringParser.getParser(),
				"utf-8",
				true,
				'e',
				"encoding",
				"encoding of input and output files, if other than utf-8. Use the same "+
		"naming you would use if specifying this charset in a java program");
		jsap.registerParameter(encodingopt);

		// what the input is and what happens to it
		FlaggedOption transformopt = new FlaggedOption("xform",
				EnumeratedStringParser.getParser("normalize; convert"),
				"normalize",
				true,
				'x',
				"xform",
				"normalize: read a grammar and remove epsilon rules, unit rules and useless symbols, "+
				"in that order. convert: read a pushdown automaton and write an equivalent grammar");
		jsap.registerParameter(transformopt);

		// how the automaton accepts. no default: it has to be stated unless there is exactly one accepting state
		FlaggedOption acceptopt = new FlaggedOption("acceptance",
				EnumeratedStringParser.getParser("empty; final; emptyfinal"),
				null,
				false,
				'a',
				"acceptance",
				"with -x convert, how the automaton accepts: empty (by empty stack), final (by entering an "+
				"accepting state), or emptyfinal (by emptying the stack in an accepting state). May be "+
				"omitted only if the automaton has exactly one accepting state, in which case emptyfinal is used");
		jsap.registerParameter(acceptopt);

		Switch noepsstartsw = new Switch("noepsstart",
				JSAP.NO_SHORTFLAG,
				"noepsstart",
				"do not keep start -> *e* when the start can derive the empty string; the empty "+
				"string is then dropped from the language");
		jsap.registerParameter(noepsstartsw);

		Switch normalizesw = new Switch("normalize",
				JSAP.NO_SHORTFLAG,
				"normalize",
				"with -x convert, also normalize the grammar that conversion produces");
		jsap.registerParameter(normalizesw);

		Switch foldsw = new Switch("fold",
				JSAP.NO_SHORTFLAG,
				"fold",
				"write all alternatives of a nonterminal on one line, separated by |");
		jsap.registerParameter(foldsw);

		// report timing of each stage at this level or below
		FlaggedOption timeopt = new FlaggedOption("time",
				IntegerStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"time",
				"print timing information at this level of detail (1 = overall, 2 = every stage)");
		jsap.registerParameter(timeopt);

		Switch csw = new Switch("check",
				'c',
				"check",
				"instead of the grammar, print the number of nonterminals, rules, and terminals, "+
				"and whether the grammar is in normalized form");
		jsap.registerParameter(csw);

		// output file - if specified, whatever is written is written here. otherwise to stdout
		FlaggedOption outfileopt =
			new FlaggedOption("outfile",
					FileStringParser.getParser(),
					null,
					false,
					'o',
					"outputfile",
					"file to write output grammar or summary. If absent, writing is done "+
			"to stdout");
		jsap.registerParameter(outfileopt);

		UnflaggedOption infileopt = new UnflaggedOption("infile",
				FileStringParser.getParser(),
				"-",
				true,
				false,
				"input grammar (-x normalize) or pushdown automaton (-x convert). The special symbol '-' "+
				"(no quote) reads from STDIN");
		jsap.registerParameter(infileopt);

		JSAPResult config = jsap.parse(argv);
		if (!config.success())
			return config;
		XF xformtype = XF.get(config.getString("xform"));
		if (xformtype == XF.NORMALIZE && config.contains("acceptance"))
			throw new ConfigureException("--acceptance (-a) only applies to -x convert");
		if (xformtype == XF.NORMALIZE && config.getBoolean("normalize"))
			throw new ConfigureException("--normalize only applies to -x convert; -x normalize always normalizes");
		return config;
	}

	// the whole program, with its streams passed in. returns the exit status
	public static int run(String[] argv, InputStream in, OutputStream out) {
		boolean debug = false;
		Date startTime = new Date();
		JSAP jsap = new JSAP();
		JSAPResult config = null;
		String encoding = null;
		XF xformtype = null;
		AcceptanceMode mode = null;
		try {
			config = processParameters(jsap, argv);
			if (config.getBoolean("help", false)) {
				Debug.prettyDebug("Usage: java "+CfgTools.class.getName()+" "+jsap.getUsage()+"\n"+jsap.getHelp());
				return 0;
			}
			if (!config.success()) {
				StringBuffer sb = new StringBuffer();
				for (Iterator errs = config.getErrorMessageIterator(); errs.hasNext(); )
					sb.append("Error: "+errs.next()+"\n");
				throw new ConfigureException(sb.toString().trim());
			}
			encoding = config.getString("encoding");
			Debug.setEncoding(encoding);
			if (config.contains("time"))
				Debug.setDbLevel(config.getInt("time"));
			xformtype = XF.get(config.getString("xform"));
			if (config.contains("acceptance"))
				mode = AcceptanceMode.get(config.getString("acceptance"));
		}
		catch (ConfigureException e) {
			Debug.prettyDebug(e.getMessage());
			Debug.prettyDebug("Usage: java "+CfgTools.class.getName()+" "+jsap.getUsage());
			return 1;
		}
		catch (JSAPException e) {
			Debug.prettyDebug("Parameter error: "+e.getMessage());
			return 1;
		}

		File infile = config.getFile("infile");
		File outfile = config.getFile("outfile");
		Normalizer normalizer = new Normalizer(!config.getBoolean("noepsstart"));
		try {
			BufferedReader br = null;
			if (infile.getName().equals("-")) {
				if (debug) Debug.debug(debug, "Reading from stdin");
				br = new BufferedReader(new InputStreamReader(in, encoding));
			}
			else {
				if (debug) Debug.debug(debug, "Reading from "+infile.getName());
				br = new BufferedReader(new InputStreamReader(new FileInputStream(infile), encoding));
			}
			StringBuffer summary = new StringBuffer();
			CFGRuleSet result;
			try {
				if (xformtype == XF.NORMALIZE) {
					CFGRuleSet rs = GrammarReader.read(br);
					Debug.dbtime(1, startTime, "read grammar");
					if (config.getBoolean("check"))
						getRuleSetCheck(summary, infile.getName(), rs);
					result = normalizer.normalize(rs);
				}
				else {
					PDARuleSet pda = PDAReader.read(br);
					Debug.dbtime(1, startTime, "read automaton");
					if (config.getBoolean("check"))
						getPDACheck(summary, infile.getName(), pda);
					result = PDAToCFG.convert(pda, mode);
					if (config.getBoolean("normalize"))
						result = normalizer.normalize(result);
				}
			}
			finally {
				br.close();
			}
			Debug.dbtime(1, startTime, "transformed");

			Writer w = null;
			if (outfile != null)
				w = new OutputStreamWriter(new FileOutputStream(outfile), encoding);
			else
				w = new OutputStreamWriter(out, encoding);
			try {
				if (config.getBoolean("check")) {
					getRuleSetCheck(summary, "result", result);
					w.write(summary.toString());
				}
				else if (config.getBoolean("fold"))
					w.write(result.toAlternativesString());
				else
					result.print(w);
				w.flush();
			}
			finally {
				if (outfile != null)
					w.close();
			}
		}
		catch (AmbiguousAcceptanceException e) {
			Debug.prettyDebug(e.getMessage());
			return 1;
		}
		catch (DataFormatException e) {
			Debug.prettyDebug("Bad input in "+infile.getName()+": "+e.getMessage());
			return 1;
		}
		catch (IOException e) {
			Debug.prettyDebug("Couldn't read or write: "+e.getMessage());
			return 1;
		}
		Debug.dbtime(1, startTime, "total");
		return 0;
	}

	public static void main(String argv[]) {
		Debug.prettyDebug("This is cfgtools, version "+VERSION);
		int status = run(argv, System.in, System.out);
		if (status != 0)
			System.exit(status);
	}
}
