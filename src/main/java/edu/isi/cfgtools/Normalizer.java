package edu.isi.cfgtools;

import java.util.Date;

/**
 * The three cleanup stages in the only order that works: epsilon removal, then
 * unit removal, then useless symbol pruning. Unit removal can only see the unit
 * rules that epsilon removal creates if it runs after it, and pruning has to see
 * the final set of alternatives.
 * <p>
 * Running a normalizer on its own output gives back the same rules, possibly in
 * a different order.
 */
public class Normalizer {

	private final boolean keepStartEpsilon;

	public Normalizer() {
		this(true);
	}

	/** @param keepStartEpsilon whether start -&gt; *e* survives when the start derives the empty string */
	public Normalizer(boolean keepStartEpsilon) {
		this.keepStartEpsilon = keepStartEpsilon;
	}

	public boolean isKeepStartEpsilon() { return keepStartEpsilon; }

	public CFGRuleSet normalize(CFGRuleSet rs) {
		boolean debug = false;
		Date startTime = new Date();
		CFGRuleSet noEps = EpsilonRemoval.removeEpsilons(rs, keepStartEpsilon);
		if (debug) Debug.debug(debug, "epsilon removal: "+rs.getNumRules()+" -> "+noEps.getNumRules()+" rules");
		Debug.dbtime(2, startTime, "removed epsilons");

		startTime = new Date();
		CFGRuleSet noUnits = UnitRemoval.removeUnits(noEps);
		if (debug) Debug.debug(debug, "unit removal: "+noEps.getNumRules()+" -> "+noUnits.getNumRules()+" rules");
		Debug.dbtime(2, startTime, "removed unit rules");

		startTime = new Date();
		CFGRuleSet pruned = UselessPruning.pruneUseless(noUnits);
		if (debug) Debug.debug(debug, "pruning: "+noUnits.getNumRules()+" -> "+pruned.getNumRules()+" rules");
		Debug.dbtime(2, startTime, "pruned useless symbols");
		return pruned;
	}
}
