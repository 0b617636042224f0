package formlang.grammar;

import formlang.FormlangException;

/**
 * Thrown if a textual grammar can't be read
 */
public class GrammarFormatException extends FormlangException {

	public final int lineNumber;

	public GrammarFormatException(int lineNumber, String message) {
		super(String.format("Line %d: %s", lineNumber, message));
		this.lineNumber = lineNumber;
	}
}
