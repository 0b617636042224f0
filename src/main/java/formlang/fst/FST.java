package formlang.fst;

import java.util.*;
import java.util.logging.Logger;

import formlang.automata.InputSymbol;
import formlang.automata.State;
import formlang.grammar.Epsilon;
import formlang.grammar.Symbol;
import formlang.grammar.Terminal;
import formlang.grammar.Variable;
import formlang.indexed.*;
import formlang.util.DotGraph;
import formlang.util.Pair;
import formlang.util.Triple;
import formlang.util.Utils;

/**
 * Finite state transducer: a non deterministic automaton whose transitions read one input symbol
 * (or epsilon) and write a word of output symbols.
 */
public class FST {

	private static final Logger LOG = Logger.getLogger(FST.class.getName());

	private final Set<State> states = new LinkedHashSet<>();

	private final Set<InputSymbol> inputSymbols = new LinkedHashSet<>();

	private final Set<InputSymbol> outputSymbols = new LinkedHashSet<>();

	private final Map<Pair<State, InputSymbol>, Set<Pair<State, List<InputSymbol>>>> delta = new LinkedHashMap<>();

	private final Set<State> startStates = new LinkedHashSet<>();

	private final Set<State> finalStates = new LinkedHashSet<>();

	/**
	 * Adds a transition, epsilons in the output are dropped
	 *
	 * @return the transducer
	 */
	public FST addTransition(State from, InputSymbol input, State to, List<InputSymbol> output){
		List<InputSymbol> cleanedOutput = new ArrayList<>();
		for (InputSymbol symbol : output){
			if (!symbol.isEpsilon()){
				cleanedOutput.add(symbol);
				outputSymbols.add(symbol);
			}
		}
		states.add(from);
		states.add(to);
		if (!input.isEpsilon()){
			inputSymbols.add(input);
		}
		delta.computeIfAbsent(new Pair<>(from, input), p -> new LinkedHashSet<>())
				.add(new Pair<>(to, Collections.unmodifiableList(cleanedOutput)));
		return this;
	}

	public FST addTransition(Object from, Object input, Object to, List<?> output){
		List<InputSymbol> symbols = new ArrayList<>();
		for (Object obj : output){
			symbols.add(InputSymbol.of(obj));
		}
		return addTransition(State.of(from), InputSymbol.of(input), State.of(to), symbols);
	}

	public FST addStartState(State state){
		states.add(state);
		startStates.add(state);
		return this;
	}

	public FST addFinalState(State state){
		states.add(state);
		finalStates.add(state);
		return this;
	}

	public Set<State> getStates() {
		return Collections.unmodifiableSet(states);
	}

	public Set<InputSymbol> getInputSymbols() {
		return Collections.unmodifiableSet(inputSymbols);
	}

	public Set<InputSymbol> getOutputSymbols() {
		return Collections.unmodifiableSet(outputSymbols);
	}

	public Set<State> getStartStates() {
		return Collections.unmodifiableSet(startStates);
	}

	public Set<State> getFinalStates() {
		return Collections.unmodifiableSet(finalStates);
	}

	/**
	 * Targets and outputs of the transitions from the state with the input symbol
	 */
	public Set<Pair<State, List<InputSymbol>>> getTransitions(State from, InputSymbol input){
		return Collections.unmodifiableSet(delta.getOrDefault(new Pair<>(from, input), Collections.emptySet()));
	}

	public int getNumberOfTransitions(){
		return delta.values().stream().mapToInt(Set::size).sum();
	}

	/**
	 * Output words for the input word. Epsilon transitions are only taken while the output is
	 * shorter than the maximum length.
	 *
	 * @param maxLength maximum output length for epsilon transitions, -1 for no bound
	 */
	public Set<List<InputSymbol>> translate(List<?> word, int maxLength){
		List<InputSymbol> input = new ArrayList<>();
		for (Object obj : word){
			InputSymbol symbol = InputSymbol.of(obj);
			if (!symbol.isEpsilon()){
				input.add(symbol);
			}
		}
		Set<List<InputSymbol>> ret = new LinkedHashSet<>();
		Set<Triple<Integer, List<InputSymbol>, State>> seen = new HashSet<>();
		Deque<Triple<Integer, List<InputSymbol>, State>> stack = new ArrayDeque<>();
		for (State start : startStates){
			stack.push(new Triple<>(0, Collections.<InputSymbol>emptyList(), start));
		}
		while (!stack.isEmpty()){
			Triple<Integer, List<InputSymbol>, State> current = stack.pop();
			if (!seen.add(current)){
				continue;
			}
			int position = current.first;
			List<InputSymbol> generated = current.second;
			if (position == input.size() && finalStates.contains(current.third)){
				ret.add(generated);
			}
			if (position < input.size()){
				for (Pair<State, List<InputSymbol>> next : getTransitions(current.third, input.get(position))){
					stack.push(new Triple<>(position + 1, Utils.concat(generated, next.second), next.first));
				}
			}
			if (maxLength == -1 || generated.size() < maxLength){
				for (Pair<State, List<InputSymbol>> next : getTransitions(current.third, InputSymbol.EPSILON)){
					stack.push(new Triple<>(position, Utils.concat(generated, next.second), next.first));
				}
			}
		}
		return ret;
	}

	/**
	 * Translation without a bound on the output, only terminates if no epsilon cycle writes output
	 */
	public Set<List<InputSymbol>> translate(List<?> word){
		return translate(word, -1);
	}

	/**
	 * Indexed grammar that generates the translations of the words generated by the passed grammar.
	 *
	 * The variables of the result are triples (p, X, q) of two states and a variable or terminal of the
	 * grammar, they generate the outputs of the runs from p to q that read a word derived from X.
	 */
	public IndexedGrammar intersection(IndexedGrammar grammar){
		Rules rules = grammar.getRules();
		Variable end = new Variable("T");
		List<ReducedRule> newRules = new ArrayList<>();
		newRules.add(new EndRule(end, Epsilon.get()));
		for (List<ConsumptionRule> consumptions : rules.getConsumptionRules().values()){
			for (ConsumptionRule consumption : consumptions){
				for (State r : states){
					for (State s : states){
						newRules.add(new ConsumptionRule(consumption.consumed, triple(r, consumption.left, s),
								triple(r, consumption.right, s)));
					}
				}
			}
		}
		for (ReducedRule rule : rules.getRules()){
			rule.accept(new RuleVisitor<Void>() {
				@Override
				public Void visit(DuplicationRule rule) {
					for (State p : states){
						for (State q : states){
							for (State r : states){
								newRules.add(new DuplicationRule(triple(p, rule.left, q), triple(p, rule.firstRight, r),
										triple(r, rule.secondRight, q)));
							}
						}
					}
					return null;
				}

				@Override
				public Void visit(ProductionRule rule) {
					for (State p : states){
						for (State q : states){
							newRules.add(new ProductionRule(triple(p, rule.left, q), triple(p, rule.right, q), rule.production));
						}
					}
					return null;
				}

				@Override
				public Void visit(ConsumptionRule rule) {
					return null;
				}

				@Override
				public Void visit(EndRule rule) {
					for (State p : states){
						for (State q : states){
							newRules.add(new DuplicationRule(triple(p, rule.left, q), triple(p, rule.right, q), end));
						}
					}
					return null;
				}
			});
		}
		Symbol epsilon = Epsilon.get();
		for (Terminal terminal : rules.getTerminals()){
			for (State p : states){
				for (State q : states){
					for (State r : states){
						newRules.add(new DuplicationRule(triple(p, terminal, q), triple(p, epsilon, r), triple(r, terminal, q)));
						newRules.add(new DuplicationRule(triple(p, terminal, q), triple(p, terminal, r), triple(r, epsilon, q)));
					}
				}
			}
		}
		for (State p : states){
			for (State q : states){
				for (State r : states){
					newRules.add(new DuplicationRule(triple(p, epsilon, q), triple(p, epsilon, r), triple(r, epsilon, q)));
				}
			}
		}
		for (Map.Entry<Pair<State, InputSymbol>, Set<Pair<State, List<InputSymbol>>>> entry : delta.entrySet()){
			State p = entry.getKey().first;
			Terminal input = Terminal.of(entry.getKey().second.value);
			for (Pair<State, List<InputSymbol>> transition : entry.getValue()){
				addOutputRules(newRules, triple(p, input, transition.first), transition.second);
			}
		}
		for (State p : states){
			newRules.add(new EndRule(triple(p, epsilon, p), Epsilon.get()));
		}
		for (State f : finalStates){
			for (State s : startStates){
				newRules.add(new DuplicationRule(Rules.DEFAULT_START, triple(s, grammar.getStartVariable(), f), end));
			}
		}
		LOG.fine(() -> String.format("Intersection of %d states and %d rules has %d rules", states.size(),
				rules.getAllRules().size(), newRules.size()));
		return new IndexedGrammar(new Rules(newRules, rules.getStrategy()), Rules.DEFAULT_START).removeUselessRules();
	}

	/**
	 * Rules that let the variable generate the output word, longer words are split by a chain of
	 * duplication rules
	 */
	private static void addOutputRules(List<ReducedRule> newRules, Variable variable, List<InputSymbol> output){
		if (output.size() <= 1){
			newRules.add(new EndRule(variable, output.isEmpty() ? Epsilon.get() : Terminal.of(output.get(0).value)));
			return;
		}
		Variable current = variable;
		for (int i = 0; i < output.size() - 1; i++){
			Variable symbolVariable = new Variable(new Triple<>(variable, output, i));
			Variable rest = i == output.size() - 2 ? new Variable(new Triple<>(variable, output, i + 1))
					: new Variable(new Triple<>(variable, output, "rest" + i));
			newRules.add(new DuplicationRule(current, symbolVariable, rest));
			newRules.add(new EndRule(symbolVariable, Terminal.of(output.get(i).value)));
			current = rest;
		}
		newRules.add(new EndRule(current, Terminal.of(output.get(output.size() - 1).value)));
	}

	private static Variable triple(State first, Symbol symbol, State second){
		return new Variable(new Triple<>(first, symbol, second));
	}

	/**
	 * Transducer that accepts the runs of both transducers
	 */
	public FST union(FST other){
		StateRenaming renaming = getStateRenaming(other);
		FST union = new FST();
		copyInto(union, renaming, 0, true, true);
		other.copyInto(union, renaming, 1, true, true);
		return union;
	}

	/**
	 * Transducer that translates the concatenation of a word of this and a word of the other transducer
	 */
	public FST concatenate(FST other){
		StateRenaming renaming = getStateRenaming(other);
		FST concatenation = new FST();
		copyInto(concatenation, renaming, 0, true, false);
		other.copyInto(concatenation, renaming, 1, false, true);
		for (State finalState : finalStates){
			for (State startState : other.startStates){
				concatenation.addTransition(renaming.getRenamedState(finalState, 0), InputSymbol.EPSILON,
						renaming.getRenamedState(startState, 1), Collections.emptyList());
			}
		}
		return concatenation;
	}

	/**
	 * Transducer that translates sequences of words, the empty sequence included
	 */
	public FST kleeneStar(){
		StateRenaming renaming = new StateRenaming();
		renaming.addStates(states, 0);
		FST star = new FST();
		copyInto(star, renaming, 0, true, true);
		for (State finalState : finalStates){
			for (State startState : startStates){
				star.addTransition(renaming.getRenamedState(finalState, 0), InputSymbol.EPSILON,
						renaming.getRenamedState(startState, 0), Collections.emptyList());
				star.addTransition(renaming.getRenamedState(startState, 0), InputSymbol.EPSILON,
						renaming.getRenamedState(finalState, 0), Collections.emptyList());
			}
		}
		return star;
	}

	private StateRenaming getStateRenaming(FST other){
		StateRenaming renaming = new StateRenaming();
		renaming.addStates(states, 0);
		renaming.addStates(other.states, 1);
		return renaming;
	}

	private void copyInto(FST target, StateRenaming renaming, int index, boolean withStartStates, boolean withFinalStates){
		if (withStartStates){
			startStates.forEach(s -> target.addStartState(renaming.getRenamedState(s, index)));
		}
		if (withFinalStates){
			finalStates.forEach(s -> target.addFinalState(renaming.getRenamedState(s, index)));
		}
		for (Map.Entry<Pair<State, InputSymbol>, Set<Pair<State, List<InputSymbol>>>> entry : delta.entrySet()){
			for (Pair<State, List<InputSymbol>> transition : entry.getValue()){
				target.addTransition(renaming.getRenamedState(entry.getKey().first, index), entry.getKey().second,
						renaming.getRenamedState(transition.first, index), transition.second);
			}
		}
		states.forEach(s -> target.states.add(renaming.getRenamedState(s, index)));
	}

	/**
	 * Graphviz representation, the edges are labelled with <code>input:output</code>
	 */
	public String toDot(){
		DotGraph graph = new DotGraph("FST");
		for (State state : states){
			graph.node(state);
		}
		for (State state : startStates){
			graph.startNode(state);
		}
		for (State state : finalStates){
			graph.finalNode(state);
		}
		for (Map.Entry<Pair<State, InputSymbol>, Set<Pair<State, List<InputSymbol>>>> entry : delta.entrySet()){
			for (Pair<State, List<InputSymbol>> transition : entry.getValue()){
				graph.edge(entry.getKey().first, transition.first,
						entry.getKey().second + ":" + Utils.join(" ", transition.second));
			}
		}
		return graph.toString();
	}
}
