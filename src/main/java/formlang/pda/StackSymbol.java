package formlang.pda;

import java.io.Serializable;
import java.util.Objects;

import formlang.grammar.Epsilon;

/**
 * Symbol on the stack of a push down automaton
 */
public class StackSymbol implements Serializable {

	/**
	 * Stands for no symbol, dropped from pushed words
	 */
	public static final StackSymbol EPSILON = new StackSymbol("epsilon");

	public final Object value;

	public StackSymbol(Object value) {
		this.value = Objects.requireNonNull(value);
	}

	public static StackSymbol of(Object value){
		if (value instanceof StackSymbol){
			return (StackSymbol)value;
		}
		if (value instanceof Epsilon || Epsilon.isAlias(value)){
			return EPSILON;
		}
		return new StackSymbol(value);
	}

	public boolean isEpsilon(){
		return equals(EPSILON);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof StackSymbol && ((StackSymbol)obj).value.equals(value);
	}

	@Override
	public int hashCode() {
		return value.hashCode() * 7;
	}

	@Override
	public String toString() {
		return value.toString();
	}
}
