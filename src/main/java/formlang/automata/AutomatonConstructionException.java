package formlang.automata;

import formlang.FormlangException;

/**
 * Thrown if a transition violates the constraints of an automaton
 */
public class AutomatonConstructionException extends FormlangException {

	public AutomatonConstructionException(String message) {
		super(message);
	}
}
