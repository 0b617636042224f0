package formlang.fst;

import java.util.*;

import formlang.automata.State;
import formlang.util.Pair;

/**
 * Gives the states of several transducers distinct names, a state keeps its name unless another
 * transducer already used it, then a counter is appended.
 */
public class StateRenaming {

	private final Map<Pair<String, Integer>, String> renaming = new HashMap<>();

	private final Set<String> seen = new HashSet<>();

	/**
	 * @param index index of the transducer the state belongs to
	 */
	public void addState(State state, int index){
		String name = state.toString();
		String newName = name;
		int counter = 0;
		while (seen.contains(newName)){
			newName = name + counter++;
		}
		renaming.put(new Pair<>(name, index), newName);
		seen.add(newName);
	}

	public void addStates(Collection<State> states, int index){
		for (State state : states){
			addState(state, index);
		}
	}

	/**
	 * @throws NoSuchElementException if the state wasn't added for the index
	 */
	public State getRenamedState(State state, int index){
		String name = renaming.get(new Pair<>(state.toString(), index));
		if (name == null){
			throw new NoSuchElementException(String.format("State %s of transducer %d", state, index));
		}
		return new State(name);
	}
}
