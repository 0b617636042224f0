package formlang.automata;

import formlang.FormlangException;

/**
 * Thrown if a regular expression can't be parsed
 */
public class MisformedRegexException extends FormlangException {

	public final String regex;

	public MisformedRegexException(String message, String regex) {
		super(message + " Regex: " + regex);
		this.regex = regex;
	}
}
