package formlang.parser.rd;

import formlang.FormlangException;

/**
 * Thrown if the recursive descent parser exceeds its maximum expansion depth, typically because of
 * left recursion
 */
public class RecursionLimitException extends FormlangException {

	public RecursionLimitException(int depth) {
		super(String.format("Exceeded the maximum recursion depth of %d", depth));
	}
}
