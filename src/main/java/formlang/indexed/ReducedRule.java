package formlang.indexed;

import java.util.Set;

import formlang.grammar.Terminal;
import formlang.grammar.Variable;

/**
 * Rule of an indexed grammar in reduced form.
 *
 * Every rule has a single variable on its left side, the kind specific parts are only accessible
 * on the concrete classes, generic code uses {@link #accept(RuleVisitor)}.
 */
public abstract class ReducedRule {

	public final Variable left;

	protected ReducedRule(Variable left) {
		this.left = left;
	}

	public abstract <R> R accept(RuleVisitor<R> visitor);

	/**
	 * Variables that occur in the rule
	 */
	public abstract Set<Variable> getNonTerminals();

	/**
	 * Terminals that occur in the rule, including the index terminals
	 */
	public abstract Set<Terminal> getTerminals();
}
