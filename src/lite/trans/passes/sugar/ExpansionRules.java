package lite.trans.passes.sugar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The catalog of sugar spellings the expression sugar expansion recognises.
 */
public final class ExpansionRules {
	private ExpansionRules() {}

	public static final List<ExpansionRule> CATALOG;
	private static final Set<String> NAMES;

	static {
		List<ExpansionRule> rules = new ArrayList<>();
		addCollectionRule(rules, "sort", SugarOperation.SORT);
		addCollectionRule(rules, "sorted", SugarOperation.SORT);
		addCollectionRule(rules, "reverse", SugarOperation.REVERSE);
		addCollectionRule(rules, "unique", SugarOperation.UNIQUE);
		addCollectionRule(rules, "sum", SugarOperation.SUM);
		addCollectionRule(rules, "mul", SugarOperation.MUL);
		addCollectionRule(rules, "max", SugarOperation.MAX);
		addCollectionRule(rules, "min", SugarOperation.MIN);
		addCollectionRule(rules, "len", SugarOperation.LEN);

		addComparisonRule(rules, "filter", SugarOperation.FILTER);
		addComparisonRule(rules, "filter!", SugarOperation.FILTER_NOT);
		addComparisonRule(rules, "count", SugarOperation.COUNT);
		addComparisonRule(rules, "count!", SugarOperation.COUNT_NOT);

		rules.add(ExpansionRule.standalone("range", SugarOperation.RANGE));

		CATALOG = Collections.unmodifiableList(rules);
		Set<String> names = new HashSet<>();
		for(ExpansionRule rule : rules) {
			names.add(baseName(rule.getSpelling()));
		}
		NAMES = Collections.unmodifiableSet(names);
	}

	private static void addCollectionRule(List<ExpansionRule> rules, String spelling, SugarOperation operation) {
		rules.add(ExpansionRule.standalone(spelling, operation));
		rules.add(ExpansionRule.member(spelling, operation));
	}

	private static void addComparisonRule(List<ExpansionRule> rules, String spelling, SugarOperation operation) {
		rules.add(ExpansionRule.standalone(spelling, operation));
		rules.add(ExpansionRule.memberCall(spelling, operation));
	}

	private static String baseName(String spelling) {
		return spelling.endsWith("!") ? spelling.substring(0, spelling.length() - 1) : spelling;
	}

	/**
	 * @return whether some rule is spelled with this identifier, with or without a {@code !}
	 */
	public static boolean isSugarName(String identifier) {
		return NAMES.contains(identifier);
	}

	/**
	 * @return the rule with this spelling and shape, or null if there is none
	 */
	public static ExpansionRule find(String spelling, CallShape shape) {
		for(ExpansionRule rule : CATALOG) {
			if(rule.getSpelling().equals(spelling) && rule.getShape() == shape) {
				return rule;
			}
		}
		return null;
	}
}
