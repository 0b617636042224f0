package formlang.automata;

import java.io.Serializable;
import java.util.Objects;

/**
 * A state of an automaton, identified by its value
 */
public class State implements Serializable {

	public final Object value;

	public State(Object value) {
		this.value = Objects.requireNonNull(value);
	}

	public static State of(Object value){
		if (value instanceof State){
			return (State)value;
		}
		return new State(value);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof State && ((State)obj).value.equals(value);
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
