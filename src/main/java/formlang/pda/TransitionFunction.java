package formlang.pda;

import java.util.*;

import formlang.automata.InputSymbol;
import formlang.automata.State;
import formlang.util.Triple;

/**
 * Transitions of a push down automaton, indexed by state, input symbol and top of the stack
 */
public class TransitionFunction implements Iterable<Transition> {

	private final Map<Triple<State, InputSymbol, StackSymbol>, Set<Transition>> transitions = new LinkedHashMap<>();

	public void add(Transition transition){
		transitions.computeIfAbsent(new Triple<>(transition.from, transition.input, transition.stackFrom),
				t -> new LinkedHashSet<>()).add(transition);
	}

	/**
	 * @return true if the transition existed
	 */
	public boolean remove(Transition transition){
		Set<Transition> set = transitions.get(new Triple<>(transition.from, transition.input, transition.stackFrom));
		return set != null && set.remove(transition);
	}

	public Set<Transition> get(State from, InputSymbol input, StackSymbol stackFrom){
		return Collections.unmodifiableSet(transitions.getOrDefault(new Triple<>(from, input, stackFrom),
				Collections.emptySet()));
	}

	public boolean contains(Transition transition){
		return get(transition.from, transition.input, transition.stackFrom).contains(transition);
	}

	public int size(){
		return transitions.values().stream().mapToInt(Set::size).sum();
	}

	public TransitionFunction copy(){
		TransitionFunction copy = new TransitionFunction();
		forEach(copy::add);
		return copy;
	}

	@Override
	public Iterator<Transition> iterator() {
		List<Transition> all = new ArrayList<>();
		transitions.values().forEach(all::addAll);
		return all.iterator();
	}
}
