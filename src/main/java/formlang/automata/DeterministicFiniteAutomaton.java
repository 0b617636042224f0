package formlang.automata;

import java.util.*;
import java.util.logging.Logger;

/**
 * Deterministic finite automaton: a single start state, no epsilon transitions and at most
 * one transition per state and symbol. The transition function might be partial.
 */
public class DeterministicFiniteAutomaton extends FiniteAutomaton {

	private static final Logger LOG = Logger.getLogger(DeterministicFiniteAutomaton.class.getName());

	@Override
	protected void checkTransition(State from, InputSymbol symbol, State to) {
		if (symbol.isEpsilon()){
			throw new AutomatonConstructionException(String.format("Epsilon transition from %s in a deterministic automaton", from));
		}
		State previous = getNextState(from, symbol);
		if (previous != null && !previous.equals(to)){
			throw new AutomatonConstructionException(String.format("Transition from %s with %s already leads to %s",
					from, symbol, previous));
		}
	}

	/**
	 * Sets the start state, replacing the previous one
	 */
	@Override
	public DeterministicFiniteAutomaton addStartState(State state) {
		startStates.clear();
		super.addStartState(state);
		return this;
	}

	/**
	 * @return the start state or null
	 */
	public State getStartState(){
		return startStates.isEmpty() ? null : startStates.iterator().next();
	}

	/**
	 * @return the next state or null if there is no transition
	 */
	public State getNextState(State from, InputSymbol symbol){
		Set<State> targets = getTransitions(from, symbol);
		return targets.isEmpty() ? null : targets.iterator().next();
	}

	@Override
	public DeterministicFiniteAutomaton toDeterministic() {
		return this;
	}

	/**
	 * Hopcroft's minimization: removes unreachable states, completes the automaton with a sink
	 * and refines the partition into final and non final states. States equivalent to the sink
	 * are dropped, so the result is the minimal partial automaton.
	 */
	@Override
	public DeterministicFiniteAutomaton minimize() {
		DeterministicFiniteAutomaton ret = new DeterministicFiniteAutomaton();
		State start = getStartState();
		if (start == null){
			return ret;
		}
		List<State> reachable = new ArrayList<>(reachableStates());
		State sink = new State(new Object(){
			@Override
			public String toString() {
				return "TRASH";
			}
		});
		reachable.add(sink);
		Map<State, Map<InputSymbol, List<State>>> inverse = new HashMap<>();
		for (State state : reachable){
			for (InputSymbol symbol : inputSymbols){
				State next = state == sink ? sink : getNextState(state, symbol);
				if (next == null){
					next = sink;
				}
				inverse.computeIfAbsent(next, s -> new HashMap<>()).computeIfAbsent(symbol, s -> new ArrayList<>()).add(state);
			}
		}
		Partition partition = new Partition();
		List<State> finals = new ArrayList<>();
		List<State> nonFinals = new ArrayList<>();
		for (State state : reachable){
			(finalStates.contains(state) ? finals : nonFinals).add(state);
		}
		Deque<Map.Entry<Integer, InputSymbol>> toProcess = new ArrayDeque<>();
		Set<Map.Entry<Integer, InputSymbol>> pending = new HashSet<>();
		if (!finals.isEmpty()){
			partition.addClass(finals);
		}
		partition.addClass(nonFinals);
		int smaller = finals.isEmpty() || finals.size() > nonFinals.size() ? partition.size() - 1 : 0;
		for (InputSymbol symbol : inputSymbols){
			push(toProcess, pending, smaller, symbol);
		}
		while (!toProcess.isEmpty()){
			Map.Entry<Integer, InputSymbol> current = toProcess.pop();
			pending.remove(current);
			List<State> splitter = new ArrayList<>();
			for (State state : partition.getClass(current.getKey())){
				splitter.addAll(inverse.getOrDefault(state, Collections.emptyMap())
						.getOrDefault(current.getValue(), Collections.emptyList()));
			}
			for (int toSplit : partition.getValidSets(splitter)){
				int created = partition.split(toSplit, splitter);
				for (InputSymbol symbol : inputSymbols){
					if (pending.contains(new AbstractMap.SimpleImmutableEntry<>(toSplit, symbol))
							|| partition.getClass(created).size() <= partition.getClass(toSplit).size()){
						push(toProcess, pending, created, symbol);
					} else {
						push(toProcess, pending, toSplit, symbol);
					}
				}
			}
		}
		Map<Integer, State> classStates = new HashMap<>();
		int sinkClass = partition.getClassIndex(sink);
		for (int i = 0; i < partition.size(); i++){
			if (i != sinkClass){
				classStates.put(i, EpsilonNFA.toSingleState(partition.getClass(i)));
			}
		}
		int startClass = partition.getClassIndex(start);
		if (startClass == sinkClass){
			ret.addStartState(start);
			return ret;
		}
		ret.addStartState(classStates.get(startClass));
		for (State state : reachable){
			int stateClass = partition.getClassIndex(state);
			if (stateClass == sinkClass){
				continue;
			}
			State from = classStates.get(stateClass);
			if (finalStates.contains(state)){
				ret.addFinalState(from);
			}
			for (InputSymbol symbol : inputSymbols){
				State next = getNextState(state, symbol);
				if (next != null && partition.getClassIndex(next) != sinkClass){
					ret.addTransition(from, symbol, classStates.get(partition.getClassIndex(next)));
				}
			}
		}
		LOG.finer(() -> String.format("Minimized automaton from %d to %d states", states.size(), ret.states.size()));
		return ret;
	}

	private static void push(Deque<Map.Entry<Integer, InputSymbol>> toProcess, Set<Map.Entry<Integer, InputSymbol>> pending,
	                         int classIndex, InputSymbol symbol){
		Map.Entry<Integer, InputSymbol> entry = new AbstractMap.SimpleImmutableEntry<>(classIndex, symbol);
		if (pending.add(entry)){
			toProcess.push(entry);
		}
	}

	private Set<State> reachableStates(){
		Set<State> reachable = new LinkedHashSet<>();
		Deque<State> stack = new ArrayDeque<>();
		reachable.add(getStartState());
		stack.push(getStartState());
		while (!stack.isEmpty()){
			State current = stack.pop();
			for (Set<State> targets : transitions.getOrDefault(current, Collections.emptyMap()).values()){
				for (State next : targets){
					if (reachable.add(next)){
						stack.push(next);
					}
				}
			}
		}
		return reachable;
	}
}
