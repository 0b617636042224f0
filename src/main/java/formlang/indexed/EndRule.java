package formlang.indexed;

import java.util.Objects;
import java.util.Set;

import formlang.grammar.Epsilon;
import formlang.grammar.Terminal;
import formlang.grammar.Variable;
import formlang.util.Utils;

/**
 * <code>A[σ] → a</code>, the terminal might be epsilon
 */
public class EndRule extends ReducedRule {

	public final Terminal right;

	public EndRule(Variable left, Terminal right) {
		super(left);
		this.right = right;
	}

	public EndRule(Object left, Object right) {
		this(Variable.of(left), Terminal.of(right));
	}

	@Override
	public <R> R accept(RuleVisitor<R> visitor) {
		return visitor.visit(this);
	}

	@Override
	public Set<Variable> getNonTerminals() {
		return Utils.set(left);
	}

	@Override
	public Set<Terminal> getTerminals() {
		if (right instanceof Epsilon){
			return Utils.set();
		}
		return Utils.set(right);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof EndRule)){
			return false;
		}
		EndRule other = (EndRule)obj;
		return left.equals(other.left) && right.equals(other.right);
	}

	@Override
	public int hashCode() {
		return Objects.hash(left, right);
	}

	@Override
	public String toString() {
		return left + " -> " + right;
	}
}
