package tacheck.trans.passes.effects;

import tacheck.model.expr.Expression;
import tacheck.model.stmt.StatementExpressionVisitor;

import java.util.List;

/**
 * Collects the top-level expressions of a statement that spawn, exit or inspect dynamic
 * processes, directly or in a sub-expression.
 */
public class CollectDynamicExpressionsVisitor extends StatementExpressionVisitor<RuntimeException> {

	private final List<Expression> expressions;

	public CollectDynamicExpressionsVisitor(List<Expression> expressions) {
		this.expressions = expressions;
	}

	@Override
	protected void visitExpression(Expression expression) {
		if (expression.isDynamic() || expression.hasDynamicSub()) {
			expressions.add(expression);
		}
	}

}
