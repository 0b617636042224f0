package formlang.indexed;

import java.util.*;

import formlang.grammar.Terminal;
import formlang.grammar.Variable;

/**
 * Immutable rule set of an indexed grammar.
 *
 * The duplication, production and end rules are kept in a list ordered by a {@link RuleOrdering.Strategy},
 * the consumption rules are grouped by the terminal they consume. Duplicates are dropped.
 * Orderings that depend on the start variable use the one passed here, <code>S</code> by default.
 */
public class Rules {

	public static final Variable DEFAULT_START = new Variable("S");

	private final List<ReducedRule> rules;

	private final Map<Terminal, List<ConsumptionRule>> consumptionRules;

	private final RuleOrdering.Strategy strategy;

	private final Variable startVariable;

	public Rules(Collection<? extends ReducedRule> rules, RuleOrdering.Strategy strategy, Variable startVariable) {
		this.strategy = strategy;
		this.startVariable = startVariable;
		List<ReducedRule> ruleList = new ArrayList<>();
		Set<ReducedRule> seen = new HashSet<>();
		Map<Terminal, List<ConsumptionRule>> consumption = new LinkedHashMap<>();
		for (ReducedRule rule : rules){
			if (!seen.add(rule)){
				continue;
			}
			if (rule instanceof ConsumptionRule){
				ConsumptionRule consumptionRule = (ConsumptionRule)rule;
				consumption.computeIfAbsent(consumptionRule.consumed, t -> new ArrayList<>()).add(consumptionRule);
			} else {
				ruleList.add(rule);
			}
		}
		Map<Terminal, List<ConsumptionRule>> unmodifiable = new LinkedHashMap<>();
		consumption.forEach((t, l) -> unmodifiable.put(t, Collections.unmodifiableList(l)));
		this.consumptionRules = Collections.unmodifiableMap(unmodifiable);
		this.rules = Collections.unmodifiableList(new RuleOrdering(ruleList, consumptionRules, startVariable).order(strategy));
	}

	public Rules(Collection<? extends ReducedRule> rules, RuleOrdering.Strategy strategy) {
		this(rules, strategy, DEFAULT_START);
	}

	/**
	 * Uses the rule ordering strategy from the config
	 */
	public Rules(Collection<? extends ReducedRule> rules) {
		this(rules, RuleOrdering.Strategy.getDefault());
	}

	/**
	 * Ordered duplication, production and end rules
	 */
	public List<ReducedRule> getRules() {
		return rules;
	}

	public Map<Terminal, List<ConsumptionRule>> getConsumptionRules() {
		return consumptionRules;
	}

	public List<ConsumptionRule> getConsumptionRules(Terminal consumed){
		return consumptionRules.getOrDefault(consumed, Collections.emptyList());
	}

	public RuleOrdering.Strategy getStrategy() {
		return strategy;
	}

	public Variable getStartVariable() {
		return startVariable;
	}

	/**
	 * Returns this rule set if it's already ordered for the passed start variable, or a reordered copy
	 */
	public Rules withStartVariable(Variable start){
		if (start.equals(startVariable)){
			return this;
		}
		return new Rules(getAllRules(), strategy, start);
	}

	/**
	 * All rules, the consumption rules last
	 */
	public List<ReducedRule> getAllRules(){
		List<ReducedRule> ret = new ArrayList<>(rules);
		consumptionRules.values().forEach(ret::addAll);
		return ret;
	}

	/**
	 * Number of non consumption rules and number of consumed terminals
	 */
	public int[] getLength(){
		return new int[]{rules.size(), consumptionRules.size()};
	}

	public Set<Variable> getNonTerminals(){
		Set<Variable> ret = new LinkedHashSet<>();
		for (ReducedRule rule : getAllRules()){
			ret.addAll(rule.getNonTerminals());
		}
		return ret;
	}

	public Set<Terminal> getTerminals(){
		Set<Terminal> ret = new LinkedHashSet<>();
		for (ReducedRule rule : getAllRules()){
			ret.addAll(rule.getTerminals());
		}
		return ret;
	}

	/**
	 * Returns a new rule set that additionally contains the passed rule
	 */
	public Rules withRule(ReducedRule rule){
		List<ReducedRule> all = getAllRules();
		all.add(rule);
		return new Rules(all, strategy, startVariable);
	}

	/**
	 * Returns a new rule set without the passed rule
	 */
	public Rules withoutRule(ReducedRule rule){
		List<ReducedRule> all = getAllRules();
		all.remove(rule);
		return new Rules(all, strategy, startVariable);
	}

	public Rules withProduction(Object left, Object right, Object production){
		return withRule(new ProductionRule(left, right, production));
	}

	public Rules withoutProduction(Object left, Object right, Object production){
		return withoutRule(new ProductionRule(left, right, production));
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (ReducedRule rule : getAllRules()){
			builder.append(rule).append("\n");
		}
		return builder.toString();
	}
}
