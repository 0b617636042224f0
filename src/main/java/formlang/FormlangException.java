package formlang;

/**
 * Base class of all errors thrown by the formal language engines.
 */
public class FormlangException extends RuntimeException {

	public FormlangException(String message) {
		super(message);
	}

	public FormlangException(String message, Throwable cause) {
		super(message, cause);
	}
}
