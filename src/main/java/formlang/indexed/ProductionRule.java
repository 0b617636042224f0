package formlang.indexed;

import java.util.Objects;
import java.util.Set;

import formlang.grammar.Terminal;
import formlang.grammar.Variable;
import formlang.util.Utils;

/**
 * <code>A[σ] → B[f σ]</code>, pushes the index terminal f
 */
public class ProductionRule extends ReducedRule {

	public final Variable right;

	public final Terminal production;

	public ProductionRule(Variable left, Variable right, Terminal production) {
		super(left);
		this.right = right;
		this.production = production;
	}

	public ProductionRule(Object left, Object right, Object production) {
		this(Variable.of(left), Variable.of(right), Terminal.of(production));
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
		return Utils.set(production);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof ProductionRule)){
			return false;
		}
		ProductionRule other = (ProductionRule)obj;
		return left.equals(other.left) && right.equals(other.right) && production.equals(other.production);
	}

	@Override
	public int hashCode() {
		return Objects.hash(left, right, production);
	}

	@Override
	public String toString() {
		return left + " -> " + right + "[" + production + "]";
	}
}
