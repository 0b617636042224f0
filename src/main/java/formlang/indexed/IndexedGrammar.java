package formlang.indexed;

import java.util.*;

import formlang.automata.FiniteAutomaton;
import formlang.automata.Regex;
import formlang.grammar.Terminal;
import formlang.grammar.Variable;

/**
 * Indexed grammar in reduced form: every variable carries a stack of index terminals that is copied by
 * duplication rules, pushed onto by production rules and popped by consumption rules.
 */
public class IndexedGrammar {

	private final Rules rules;

	private final Variable startVariable;

	private Marking marking;

	public IndexedGrammar(Rules rules, Variable startVariable) {
		this.rules = rules.withStartVariable(startVariable);
		this.startVariable = startVariable;
	}

	/**
	 * Uses the start variable <code>S</code>
	 */
	public IndexedGrammar(Rules rules) {
		this(rules, Rules.DEFAULT_START);
	}

	public Rules getRules() {
		return rules;
	}

	public Variable getStartVariable() {
		return startVariable;
	}

	public Set<Variable> getNonTerminals(){
		Set<Variable> ret = new LinkedHashSet<>();
		ret.add(startVariable);
		ret.addAll(rules.getNonTerminals());
		return ret;
	}

	public Set<Terminal> getTerminals(){
		return rules.getTerminals();
	}

	/**
	 * Marking of this grammar, computed to the fixed point on first request
	 */
	public Marking getMarking(){
		if (marking == null){
			marking = new Marking(rules, startVariable);
			marking.run();
		}
		return marking;
	}

	/**
	 * Does the grammar generate no word?
	 */
	public boolean isEmpty(){
		return !getMarking().isStartGenerating();
	}

	/**
	 * Variables that occur in a derivation from the start variable
	 */
	public Set<Variable> getReachableNonTerminals(){
		Map<Variable, Set<Variable>> reachableFrom = new HashMap<>();
		for (ReducedRule rule : rules.getAllRules()){
			Set<Variable> targets = reachableFrom.computeIfAbsent(rule.left, v -> new LinkedHashSet<>());
			targets.addAll(rule.getNonTerminals());
			targets.remove(rule.left);
		}
		Set<Variable> reachable = new LinkedHashSet<>();
		reachable.add(startVariable);
		Deque<Variable> stack = new ArrayDeque<>();
		stack.push(startVariable);
		while (!stack.isEmpty()){
			Variable current = stack.pop();
			for (Variable next : reachableFrom.getOrDefault(current, Collections.emptySet())){
				if (reachable.add(next)){
					stack.push(next);
				}
			}
		}
		return reachable;
	}

	/**
	 * Variables that derive a word of terminals for some index stack, ignoring the stack contents.
	 *
	 * A duplication rule needs both right variables to be generating, the other rules a single one.
	 */
	public Set<Variable> getGeneratingNonTerminals(){
		Map<Variable, Set<Variable>> generatingFrom = new HashMap<>();
		Map<Variable, List<int[]>> duplicationPointers = new HashMap<>();
		List<Variable> duplicationHeads = new ArrayList<>();
		Set<Variable> generating = new LinkedHashSet<>();
		Deque<Variable> stack = new ArrayDeque<>();
		for (ReducedRule rule : rules.getAllRules()){
			rule.accept(new RuleVisitor<Void>() {
				@Override
				public Void visit(DuplicationRule rule) {
					int[] pointer = {duplicationHeads.size(), 2};
					duplicationHeads.add(rule.left);
					duplicationPointers.computeIfAbsent(rule.firstRight, v -> new ArrayList<>()).add(pointer);
					duplicationPointers.computeIfAbsent(rule.secondRight, v -> new ArrayList<>()).add(pointer);
					return null;
				}

				@Override
				public Void visit(ProductionRule rule) {
					generatingFrom.computeIfAbsent(rule.right, v -> new LinkedHashSet<>()).add(rule.left);
					return null;
				}

				@Override
				public Void visit(ConsumptionRule rule) {
					generatingFrom.computeIfAbsent(rule.right, v -> new LinkedHashSet<>()).add(rule.left);
					return null;
				}

				@Override
				public Void visit(EndRule rule) {
					if (generating.add(rule.left)){
						stack.push(rule.left);
					}
					return null;
				}
			});
		}
		while (!stack.isEmpty()){
			Variable current = stack.pop();
			for (Variable next : generatingFrom.getOrDefault(current, Collections.emptySet())){
				if (generating.add(next)){
					stack.push(next);
				}
			}
			for (int[] pointer : duplicationPointers.getOrDefault(current, Collections.emptyList())){
				pointer[1]--;
				Variable head = duplicationHeads.get(pointer[0]);
				if (pointer[1] <= 0 && generating.add(head)){
					stack.push(head);
				}
			}
		}
		return generating;
	}

	/**
	 * Grammar without the rules that contain a variable that is not generating or not reachable
	 */
	public IndexedGrammar removeUselessRules(){
		Set<Variable> generating = getGeneratingNonTerminals();
		Set<Variable> reachable = getReachableNonTerminals();
		List<ReducedRule> kept = new ArrayList<>();
		for (ReducedRule rule : rules.getAllRules()){
			if (generating.containsAll(rule.getNonTerminals()) && reachable.containsAll(rule.getNonTerminals())){
				kept.add(rule);
			}
		}
		return new IndexedGrammar(new Rules(kept, rules.getStrategy()), startVariable);
	}

	/**
	 * Intersection with a regular language
	 *
	 * @param other a finite automaton or a regular expression
	 * @throws UnsupportedOperationException for other arguments
	 */
	public IndexedGrammar intersection(Object other){
		if (other instanceof Regex){
			return intersection((Regex)other);
		}
		if (other instanceof FiniteAutomaton){
			return intersection((FiniteAutomaton)other);
		}
		throw new UnsupportedOperationException(String.format("Can't intersect an indexed grammar with %s",
				other == null ? "null" : other.getClass().getSimpleName()));
	}

	public IndexedGrammar intersection(Regex regex){
		return intersection(regex.toEpsilonNfa());
	}

	public IndexedGrammar intersection(FiniteAutomaton automaton){
		return automaton.toFst().intersection(this);
	}

	@Override
	public String toString() {
		return rules.toString();
	}
}
