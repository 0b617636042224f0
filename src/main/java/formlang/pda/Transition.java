package formlang.pda;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import formlang.automata.InputSymbol;
import formlang.automata.State;
import formlang.util.Utils;

/**
 * Transition <code>(from, input, stackFrom) → (to, stackTo)</code>: in state from, reading input
 * (or epsilon) with stackFrom on top of the stack, replace stackFrom by stackTo (first element on top)
 * and go to state to
 */
public class Transition {

	public final State from;

	public final InputSymbol input;

	public final StackSymbol stackFrom;

	public final State to;

	public final List<StackSymbol> stackTo;

	public Transition(State from, InputSymbol input, StackSymbol stackFrom, State to, List<StackSymbol> stackTo) {
		this.from = from;
		this.input = input;
		this.stackFrom = stackFrom;
		this.to = to;
		this.stackTo = Collections.unmodifiableList(stackTo);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Transition)){
			return false;
		}
		Transition other = (Transition)obj;
		return from.equals(other.from) && input.equals(other.input) && stackFrom.equals(other.stackFrom)
				&& to.equals(other.to) && stackTo.equals(other.stackTo);
	}

	@Override
	public int hashCode() {
		return Objects.hash(from, input, stackFrom, to, stackTo);
	}

	@Override
	public String toString() {
		return String.format("(%s, %s, %s) -> (%s, [%s])", from, input, stackFrom, to, Utils.join(" ", stackTo));
	}
}
