package formlang.automata;

import java.util.*;

/**
 * Partition of the states used by Hopcroft's minimization. Classes are numbered in the order
 * of their creation.
 */
class Partition {

	private final List<Set<State>> classes = new ArrayList<>();

	private final Map<State, Integer> classIndices = new HashMap<>();

	/**
	 * @return index of the new class
	 */
	int addClass(Collection<State> states){
		int index = classes.size();
		classes.add(new LinkedHashSet<>(states));
		for (State state : states){
			classIndices.put(state, index);
		}
		return index;
	}

	Set<State> getClass(int index){
		return classes.get(index);
	}

	int getClassIndex(State state){
		return classIndices.get(state);
	}

	int size(){
		return classes.size();
	}

	/**
	 * Classes that contain some but not all of the passed states
	 */
	List<Integer> getValidSets(Collection<State> inverse){
		int[] counts = new int[classes.size()];
		for (State state : new HashSet<>(inverse)){
			counts[classIndices.get(state)]++;
		}
		List<Integer> ret = new ArrayList<>();
		for (int i = 0; i < counts.length; i++){
			if (counts[i] != 0 && counts[i] != classes.get(i).size()){
				ret.add(i);
			}
		}
		return ret;
	}

	/**
	 * Moves the states of the splitter that belong to the passed class into a new class
	 *
	 * @return index of the new class
	 */
	int split(int toSplit, Collection<State> splitter){
		Set<State> moved = new LinkedHashSet<>();
		for (State state : splitter){
			if (classIndices.get(state) == toSplit){
				moved.add(state);
			}
		}
		classes.get(toSplit).removeAll(moved);
		return addClass(moved);
	}
}
