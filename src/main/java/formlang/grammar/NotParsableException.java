package formlang.grammar;

import formlang.FormlangException;

/**
 * Thrown by the parsers if a word can't be parsed
 */
public class NotParsableException extends FormlangException {

	public NotParsableException(String message) {
		super(message);
	}
}
