package formlang.grammar;

import java.util.HashMap;
import java.util.Map;

import formlang.util.Triple;

/**
 * Bijection between (state, symbol, state) triples and fresh variables.
 *
 * Used by the grammar automaton intersection and by the conversion of push down automata into grammars.
 * The variables carry consecutive integers as values and are created lazily, a triple always maps
 * to the same variable instance.
 *
 * @param <S> type of the states
 * @param <X> type of the symbols in the middle of the triples
 */
public class VariableConverter<S, X> {

	private static class Conversion {
		boolean valid;
		Variable variable;
	}

	private final Map<Triple<S, X, S>, Conversion> conversions = new HashMap<>();

	private int counter = 0;

	/**
	 * Returns the variable for the passed triple, creating it on first request
	 */
	public Variable toCombinedVariable(S state0, X symbol, S state1){
		Conversion conversion = get(state0, symbol, state1);
		if (conversion.variable == null){
			conversion.variable = new Variable(counter++);
		}
		return conversion.variable;
	}

	/**
	 * Marks the triple as valid, see {@link #isValidAndGet(Object, Object, Object)}
	 */
	public void setValid(S state0, X symbol, S state1){
		get(state0, symbol, state1).valid = true;
	}

	/**
	 * Returns the variable for the passed triple if the triple was marked as valid before
	 *
	 * @return the variable or null if the triple isn't valid
	 */
	public Variable isValidAndGet(S state0, X symbol, S state1){
		Conversion conversion = conversions.get(new Triple<>(state0, symbol, state1));
		if (conversion == null || !conversion.valid){
			return null;
		}
		return toCombinedVariable(state0, symbol, state1);
	}

	/**
	 * Number of variables created so far
	 */
	public int getNumberOfVariables(){
		return counter;
	}

	private Conversion get(S state0, X symbol, S state1){
		return conversions.computeIfAbsent(new Triple<>(state0, symbol, state1), t -> new Conversion());
	}
}
