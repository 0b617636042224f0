package formlang.indexed;

import java.util.Objects;
import java.util.Set;

import formlang.grammar.Terminal;
import formlang.grammar.Variable;
import formlang.util.Utils;

/**
 * <code>A[σ] → B[σ] C[σ]</code>
 */
public class DuplicationRule extends ReducedRule {

	public final Variable firstRight;

	public final Variable secondRight;

	public DuplicationRule(Variable left, Variable firstRight, Variable secondRight) {
		super(left);
		this.firstRight = firstRight;
		this.secondRight = secondRight;
	}

	public DuplicationRule(Object left, Object firstRight, Object secondRight) {
		this(Variable.of(left), Variable.of(firstRight), Variable.of(secondRight));
	}

	@Override
	public <R> R accept(RuleVisitor<R> visitor) {
		return visitor.visit(this);
	}

	@Override
	public Set<Variable> getNonTerminals() {
		return Utils.set(left, firstRight, secondRight);
	}

	@Override
	public Set<Terminal> getTerminals() {
		return Utils.set();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof DuplicationRule)){
			return false;
		}
		DuplicationRule other = (DuplicationRule)obj;
		return left.equals(other.left) && firstRight.equals(other.firstRight) && secondRight.equals(other.secondRight);
	}

	@Override
	public int hashCode() {
		return Objects.hash(left, firstRight, secondRight);
	}

	@Override
	public String toString() {
		return left + " -> " + firstRight + " " + secondRight;
	}
}
