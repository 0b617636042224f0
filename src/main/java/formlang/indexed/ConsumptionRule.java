package formlang.indexed;

import java.util.Objects;
import java.util.Set;

import formlang.grammar.Terminal;
import formlang.grammar.Variable;
import formlang.util.Utils;

/**
 * <code>A[f σ] → B[σ]</code>, pops the index terminal f
 */
public class ConsumptionRule extends ReducedRule {

	public final Terminal consumed;

	public final Variable right;

	public ConsumptionRule(Terminal consumed, Variable left, Variable right) {
		super(left);
		this.consumed = consumed;
		this.right = right;
	}

	public ConsumptionRule(Object consumed, Object left, Object right) {
		this(Terminal.of(consumed), Variable.of(left), Variable.of(right));
	}

	@Override
	public <R> R accept(RuleVisitor<R> visitor) {
		return visitor.visit(this);
	}

	@Override
	public Set<Variable> getNonTerminals() {
		return Utils.set(left, right);
	}

	@Override
	public Set<Terminal> getTerminals() {
		return Utils.set(consumed);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof ConsumptionRule)){
			return false;
		}
		ConsumptionRule other = (ConsumptionRule)obj;
		return left.equals(other.left) && right.equals(other.right) && consumed.equals(other.consumed);
	}

	@Override
	public int hashCode() {
		return Objects.hash(consumed, left, right);
	}

	@Override
	public String toString() {
		return left + "[" + consumed + "] -> " + right;
	}
}
