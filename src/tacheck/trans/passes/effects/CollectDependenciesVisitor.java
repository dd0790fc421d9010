package tacheck.trans.passes.effects;

import tacheck.model.expr.Expression;
import tacheck.model.stmt.StatementExpressionVisitor;
import tacheck.scope.Symbol;

import java.util.Set;

/**
 * Collects the symbols a statement may read.
 */
public class CollectDependenciesVisitor extends StatementExpressionVisitor<RuntimeException> {

	private final Set<Symbol> dependencies;

	public CollectDependenciesVisitor(Set<Symbol> dependencies) {
		this.dependencies = dependencies;
	}

	@Override
	protected void visitExpression(Expression expression) {
		expression.collectPossibleReads(dependencies);
	}

}
