package formlang.grammar;

import java.io.Serializable;
import java.util.Objects;

/**
 * Base class for variables and terminals of a grammar.
 *
 * Symbols are compared by their value and their kind, so a terminal never equals a variable
 * that carries the same value.
 */
public abstract class Symbol implements Serializable, Comparable<Symbol> {

	/**
	 * Immutable value that identifies the symbol
	 */
	public final Object value;

	protected Symbol(Object value) {
		this.value = Objects.requireNonNull(value);
	}

	/**
	 * Representation of the symbol in the textual grammar format
	 */
	public abstract String toText();

	/**
	 * Does the text start with an ASCII capital letter, the mark of a variable in the textual format?
	 */
	static boolean startsWithCapital(String text){
		return !text.isEmpty() && text.charAt(0) >= 'A' && text.charAt(0) <= 'Z';
	}

	public boolean isVariable(){
		return this instanceof Variable;
	}

	@Override
	public int hashCode() {
		return value.hashCode() * 31 + getClass().getSimpleName().hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && obj.getClass() == this.getClass() && ((Symbol)obj).value.equals(value);
	}

	@Override
	public int compareTo(Symbol o) {
		int kind = getClass().getSimpleName().compareTo(o.getClass().getSimpleName());
		if (kind != 0){
			return kind;
		}
		return toString().compareTo(o.toString());
	}

	@Override
	public String toString() {
		return value.toString();
	}
}
