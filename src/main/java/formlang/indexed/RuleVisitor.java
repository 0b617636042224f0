package formlang.indexed;

/**
 * Visitor over the four kinds of reduced rules
 *
 * @param <R> result type
 */
public interface RuleVisitor<R> {

	R visit(DuplicationRule rule);

	R visit(ProductionRule rule);

	R visit(ConsumptionRule rule);

	R visit(EndRule rule);
}
