package formlang.automata;

import java.io.Serializable;
import java.util.Objects;

import formlang.grammar.Epsilon;
import formlang.grammar.Symbol;

/**
 * A symbol read by an automaton or a transducer
 */
public class InputSymbol implements Serializable {

	/**
	 * Label of transitions that don't consume a symbol
	 */
	public static final InputSymbol EPSILON = new InputSymbol("epsilon");

	public final Object value;

	private InputSymbol(Object value) {
		this.value = Objects.requireNonNull(value);
	}

	/**
	 * Wraps the passed value, the epsilon aliases (like <code>"epsilon"</code> and <code>"$"</code>)
	 * yield {@link #EPSILON}, grammar symbols are unwrapped
	 */
	public static InputSymbol of(Object value){
		if (value instanceof InputSymbol){
			return (InputSymbol)value;
		}
		if (value instanceof Epsilon || Epsilon.isAlias(value)){
			return EPSILON;
		}
		if (value instanceof Symbol){
			return new InputSymbol(((Symbol)value).value);
		}
		return new InputSymbol(value);
	}

	public boolean isEpsilon(){
		return this.equals(EPSILON);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof InputSymbol && ((InputSymbol)obj).value.equals(value);
	}

	@Override
	public int hashCode() {
		return value.hashCode();
	}

	@Override
	public String toString() {
		return value.toString();
	}
}
