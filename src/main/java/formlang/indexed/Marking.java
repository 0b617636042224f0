package formlang.indexed;

import java.util.*;
import java.util.logging.Logger;

import formlang.grammar.Variable;
import formlang.util.Pair;

/**
 * Marking fixed point that decides the emptiness of an indexed grammar.
 *
 * A set M is marked for a variable A if <code>A[σ]</code> derives, for every index stack σ, a sentential
 * form whose variables are all in M and all carry the stack σ. A variable marks itself, a variable with
 * an end rule marks the empty set. The grammar is not empty iff the empty set gets marked for the start
 * variable. The marked sets only grow, each pass over the rules either adds a set or the fixed point is
 * reached.
 */
public class Marking {

	private static final Logger LOG = Logger.getLogger(Marking.class.getName());

	private final Rules rules;

	private final Variable startVariable;

	private final Map<Variable, Set<Set<Variable>>> marked = new HashMap<>();

	private int passes = 0;

	public Marking(Rules rules, Variable startVariable) {
		this.rules = rules;
		this.startVariable = startVariable;
		Set<Variable> nonTerminals = new LinkedHashSet<>(rules.getNonTerminals());
		nonTerminals.add(startVariable);
		for (Variable variable : nonTerminals){
			marked.computeIfAbsent(variable, v -> new HashSet<>()).add(Collections.singleton(variable));
		}
		for (ReducedRule rule : rules.getRules()){
			if (rule instanceof EndRule){
				marked.get(rule.left).add(Collections.emptySet());
			}
		}
	}

	/**
	 * Is the empty set marked for the start variable?
	 */
	public boolean isStartGenerating(){
		return marked.get(startVariable).contains(Collections.<Variable>emptySet());
	}

	/**
	 * Runs passes until nothing changes or the start variable is generating
	 *
	 * @return is the start variable generating?
	 */
	public boolean run(){
		while (!isStartGenerating() && pass()){
		}
		LOG.fine(() -> String.format("Marking finished after %d passes", passes));
		return isStartGenerating();
	}

	/**
	 * Processes every rule once, stops early if the start variable becomes generating
	 *
	 * @return true if a set was marked
	 */
	public boolean pass(){
		passes++;
		boolean modified = false;
		for (ReducedRule rule : rules.getRules()){
			if (rule instanceof DuplicationRule){
				modified |= processDuplication((DuplicationRule)rule);
			} else if (rule instanceof ProductionRule){
				modified |= processProduction((ProductionRule)rule);
			}
			if (isStartGenerating()){
				return modified;
			}
		}
		return modified;
	}

	private boolean processDuplication(DuplicationRule rule){
		List<Set<Variable>> added = new ArrayList<>();
		Set<Set<Variable>> leftMarked = marked.get(rule.left);
		for (Set<Variable> first : marked.get(rule.firstRight)){
			for (Set<Variable> second : marked.get(rule.secondRight)){
				Set<Variable> merged = union(first, second);
				if (!leftMarked.contains(merged)){
					added.add(merged);
				}
			}
		}
		return leftMarked.addAll(added);
	}

	/**
	 * For a marked set M of the right variable every variable in M has to consume the pushed terminal.
	 * Picks for each of them one consumption rule and one marked set of its right variable, the left
	 * variable marks the union of the picked sets.
	 */
	private boolean processProduction(ProductionRule rule){
		List<ConsumptionRule> consumptions = rules.getConsumptionRules(rule.production);
		List<Set<Variable>> added = new ArrayList<>();
		Set<Set<Variable>> leftMarked = marked.get(rule.left);
		for (Set<Variable> rightSet : marked.get(rule.right)){
			List<Set<Set<Variable>>> options = new ArrayList<>();
			for (Variable variable : rightSet){
				Set<Set<Variable>> variableOptions = new HashSet<>();
				for (ConsumptionRule consumption : consumptions){
					if (consumption.left.equals(variable)){
						variableOptions.addAll(marked.get(consumption.right));
					}
				}
				if (variableOptions.isEmpty()){
					options = null;
					break;
				}
				options.add(variableOptions);
			}
			if (options == null){
				continue;
			}
			for (Set<Variable> combined : combine(options)){
				if (!leftMarked.contains(combined)){
					added.add(combined);
				}
			}
		}
		return leftMarked.addAll(added);
	}

	/**
	 * Unions of one element of each option set
	 */
	private static Set<Set<Variable>> combine(List<Set<Set<Variable>>> options){
		Set<Set<Variable>> ret = new HashSet<>();
		Set<Pair<Integer, Set<Variable>>> done = new HashSet<>();
		Deque<Pair<Integer, Set<Variable>>> stack = new ArrayDeque<>();
		stack.push(new Pair<>(0, Collections.<Variable>emptySet()));
		while (!stack.isEmpty()){
			Pair<Integer, Set<Variable>> current = stack.pop();
			if (current.first == options.size()){
				ret.add(current.second);
				continue;
			}
			for (Set<Variable> option : options.get(current.first)){
				Pair<Integer, Set<Variable>> next = new Pair<>(current.first + 1, union(current.second, option));
				if (done.add(next)){
					stack.push(next);
				}
			}
		}
		return ret;
	}

	private static Set<Variable> union(Set<Variable> first, Set<Variable> second){
		if (second.containsAll(first)){
			return second;
		}
		if (first.containsAll(second)){
			return first;
		}
		Set<Variable> ret = new HashSet<>(first);
		ret.addAll(second);
		return Collections.unmodifiableSet(ret);
	}

	/**
	 * Marked sets of the passed variable
	 */
	public Set<Set<Variable>> getMarked(Variable variable){
		return Collections.unmodifiableSet(marked.getOrDefault(variable, Collections.emptySet()));
	}

	/**
	 * Deep copy of the current marking
	 */
	public Map<Variable, Set<Set<Variable>>> snapshot(){
		Map<Variable, Set<Set<Variable>>> ret = new HashMap<>();
		marked.forEach((v, s) -> ret.put(v, new HashSet<>(s)));
		return ret;
	}

	public int getPasses() {
		return passes;
	}
}
