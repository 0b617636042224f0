package formlang.automata;

import java.util.*;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Non deterministic finite automaton with epsilon transitions
 */
public class EpsilonNFA extends FiniteAutomaton {

	private static final Logger LOG = Logger.getLogger(EpsilonNFA.class.getName());

	/**
	 * Makes the powerset construction, only the subsets reachable from the start states are created.
	 * The new states are named after the states they consist of.
	 *
	 * @url https://de.wikipedia.org/wiki/Potenzmengenkonstruktion
	 */
	@Override
	public DeterministicFiniteAutomaton toDeterministic() {
		DeterministicFiniteAutomaton dfa = new DeterministicFiniteAutomaton();
		Set<State> initialSet = getEpsilonClosure(startStates);
		Map<Set<State>, State> setToState = new HashMap<>();
		setToState.put(initialSet, toSingleState(initialSet));
		dfa.addStartState(setToState.get(initialSet));
		Deque<Set<State>> stack = new ArrayDeque<>();
		stack.push(initialSet);
		while (!stack.isEmpty()){
			Set<State> current = stack.pop();
			State currentState = setToState.get(current);
			if (current.stream().anyMatch(finalStates::contains)){
				dfa.addFinalState(currentState);
			}
			for (InputSymbol symbol : inputSymbols){
				Set<State> next = step(current, symbol);
				if (next.isEmpty()){
					continue;
				}
				if (!setToState.containsKey(next)){
					setToState.put(next, toSingleState(next));
					stack.push(next);
				}
				dfa.addTransition(currentState, symbol, setToState.get(next));
			}
		}
		LOG.finer(() -> String.format("Powerset construction: %d states to %d states", states.size(), setToState.size()));
		return dfa;
	}

	/**
	 * Merges the states into a state named after the sorted names of the states
	 */
	static State toSingleState(Collection<State> states){
		return new State(states.stream().map(State::toString).sorted().collect(Collectors.joining(";")));
	}
}
