package formlang.automata;

import java.util.*;

import formlang.fst.FST;
import formlang.util.DotGraph;
import formlang.util.Pair;

/**
 * Base class of the finite automata.
 *
 * Automata are built incrementally by adding transitions, start states and final states.
 */
public abstract class FiniteAutomaton {

	protected final Set<State> states = new LinkedHashSet<>();

	protected final Set<InputSymbol> inputSymbols = new LinkedHashSet<>();

	protected final Map<State, Map<InputSymbol, Set<State>>> transitions = new LinkedHashMap<>();

	protected final Set<State> startStates = new LinkedHashSet<>();

	protected final Set<State> finalStates = new LinkedHashSet<>();

	/**
	 * Adds a transition, the states and the symbol are added to the automaton
	 *
	 * @return the automaton
	 */
	public FiniteAutomaton addTransition(State from, InputSymbol symbol, State to){
		checkTransition(from, symbol, to);
		states.add(from);
		states.add(to);
		if (!symbol.isEpsilon()){
			inputSymbols.add(symbol);
		}
		transitions.computeIfAbsent(from, s -> new LinkedHashMap<>())
				.computeIfAbsent(symbol, s -> new LinkedHashSet<>()).add(to);
		return this;
	}

	public FiniteAutomaton addTransition(Object from, Object symbol, Object to){
		return addTransition(State.of(from), InputSymbol.of(symbol), State.of(to));
	}

	/**
	 * Checks whether the transition can be added
	 *
	 * @throws AutomatonConstructionException if not
	 */
	protected void checkTransition(State from, InputSymbol symbol, State to){
	}

	/**
	 * @return true if the transition existed
	 */
	public boolean removeTransition(State from, InputSymbol symbol, State to){
		Set<State> targets = transitions.getOrDefault(from, Collections.emptyMap()).get(symbol);
		return targets != null && targets.remove(to);
	}

	public FiniteAutomaton addStartState(State state){
		states.add(state);
		startStates.add(state);
		return this;
	}

	public FiniteAutomaton addFinalState(State state){
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

	public Set<State> getStartStates() {
		return Collections.unmodifiableSet(startStates);
	}

	public Set<State> getFinalStates() {
		return Collections.unmodifiableSet(finalStates);
	}

	/**
	 * Targets of the transitions from the state with the passed symbol
	 */
	public Set<State> getTransitions(State from, InputSymbol symbol){
		return Collections.unmodifiableSet(transitions.getOrDefault(from, Collections.emptyMap())
				.getOrDefault(symbol, Collections.emptySet()));
	}

	/**
	 * All transitions as (from, symbol) → to pairs
	 */
	public List<Pair<Pair<State, InputSymbol>, State>> getTransitionList(){
		List<Pair<Pair<State, InputSymbol>, State>> ret = new ArrayList<>();
		for (Map.Entry<State, Map<InputSymbol, Set<State>>> entry : transitions.entrySet()){
			for (Map.Entry<InputSymbol, Set<State>> bySymbol : entry.getValue().entrySet()){
				for (State to : bySymbol.getValue()){
					ret.add(new Pair<>(new Pair<>(entry.getKey(), bySymbol.getKey()), to));
				}
			}
		}
		return ret;
	}

	public int getNumberOfTransitions(){
		return getTransitionList().size();
	}

	/**
	 * States reachable from the passed states by epsilon transitions, including the passed states
	 */
	public Set<State> getEpsilonClosure(Collection<State> from){
		Set<State> closure = new LinkedHashSet<>(from);
		Deque<State> stack = new ArrayDeque<>(from);
		while (!stack.isEmpty()){
			State current = stack.pop();
			for (State next : getTransitions(current, InputSymbol.EPSILON)){
				if (closure.add(next)){
					stack.push(next);
				}
			}
		}
		return closure;
	}

	public Set<State> getEpsilonClosure(State from){
		return getEpsilonClosure(Collections.singleton(from));
	}

	/**
	 * States reached from the passed set of states by reading the symbol, closed under epsilon transitions
	 */
	protected Set<State> step(Set<State> current, InputSymbol symbol){
		Set<State> next = new LinkedHashSet<>();
		for (State state : current){
			next.addAll(getTransitions(state, symbol));
		}
		return getEpsilonClosure(next);
	}

	/**
	 * Does the automaton accept the word? Epsilons in the word are ignored.
	 */
	public boolean accepts(List<?> word){
		Set<State> current = getEpsilonClosure(startStates);
		for (Object obj : word){
			InputSymbol symbol = InputSymbol.of(obj);
			if (symbol.isEpsilon()){
				continue;
			}
			current = step(current, symbol);
			if (current.isEmpty()){
				return false;
			}
		}
		return current.stream().anyMatch(finalStates::contains);
	}

	/**
	 * Is there no accepted word?
	 */
	public boolean isEmpty(){
		Set<State> visited = new HashSet<>(startStates);
		Deque<State> stack = new ArrayDeque<>(startStates);
		while (!stack.isEmpty()){
			State current = stack.pop();
			if (finalStates.contains(current)){
				return false;
			}
			for (Set<State> targets : transitions.getOrDefault(current, Collections.emptyMap()).values()){
				for (State next : targets){
					if (visited.add(next)){
						stack.push(next);
					}
				}
			}
		}
		return true;
	}

	/**
	 * Is the automaton deterministic: a single start state, no epsilon transitions
	 * and at most one target per state and symbol?
	 */
	public boolean isDeterministic(){
		if (startStates.size() > 1){
			return false;
		}
		for (Map<InputSymbol, Set<State>> bySymbol : transitions.values()){
			for (Map.Entry<InputSymbol, Set<State>> entry : bySymbol.entrySet()){
				if (entry.getKey().isEpsilon() && !entry.getValue().isEmpty() || entry.getValue().size() > 1){
					return false;
				}
			}
		}
		return true;
	}

	/**
	 * Deterministic automaton that accepts the same language
	 */
	public abstract DeterministicFiniteAutomaton toDeterministic();

	/**
	 * Minimal deterministic automaton that accepts the same language
	 */
	public DeterministicFiniteAutomaton minimize(){
		return toDeterministic().minimize();
	}

	/**
	 * Do both automata accept the same language?
	 */
	public boolean isEquivalentTo(FiniteAutomaton other){
		DeterministicFiniteAutomaton first = minimize();
		DeterministicFiniteAutomaton second = other.minimize();
		Set<InputSymbol> symbols = new LinkedHashSet<>(first.inputSymbols);
		symbols.addAll(second.inputSymbols);
		Pair<State, State> start = new Pair<>(first.getStartState(), second.getStartState());
		Set<Pair<State, State>> visited = new HashSet<>();
		visited.add(start);
		Deque<Pair<State, State>> stack = new ArrayDeque<>();
		stack.push(start);
		while (!stack.isEmpty()){
			Pair<State, State> current = stack.pop();
			boolean firstFinal = current.first != null && first.finalStates.contains(current.first);
			boolean secondFinal = current.second != null && second.finalStates.contains(current.second);
			if (firstFinal != secondFinal){
				return false;
			}
			for (InputSymbol symbol : symbols){
				Pair<State, State> next = new Pair<>(
						current.first == null ? null : first.getNextState(current.first, symbol),
						current.second == null ? null : second.getNextState(current.second, symbol));
				if ((next.first != null || next.second != null) && visited.add(next)){
					stack.push(next);
				}
			}
		}
		return true;
	}

	/**
	 * Transducer that maps every accepted word onto itself
	 */
	public FST toFst(){
		FST fst = new FST();
		for (State state : startStates){
			fst.addStartState(state);
		}
		for (State state : finalStates){
			fst.addFinalState(state);
		}
		for (Pair<Pair<State, InputSymbol>, State> transition : getTransitionList()){
			InputSymbol symbol = transition.first.second;
			fst.addTransition(transition.first.first, symbol, transition.second,
					symbol.isEpsilon() ? Collections.<InputSymbol>emptyList() : Collections.singletonList(symbol));
		}
		return fst;
	}

	/**
	 * Graphviz representation, start states are filled and final states have a double border
	 */
	public String toDot(){
		DotGraph graph = new DotGraph(getClass().getSimpleName());
		for (State state : states){
			graph.node(state);
		}
		for (State state : startStates){
			graph.startNode(state);
		}
		for (State state : finalStates){
			graph.finalNode(state);
		}
		for (Pair<Pair<State, InputSymbol>, State> transition : getTransitionList()){
			graph.edge(transition.first.first, transition.second, transition.first.second.toString());
		}
		return graph.toString();
	}
}
