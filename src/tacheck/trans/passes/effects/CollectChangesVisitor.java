package tacheck.trans.passes.effects;

import tacheck.model.expr.Expression;
import tacheck.model.stmt.StatementExpressionVisitor;
import tacheck.scope.Symbol;

import java.util.Set;

/**
 * Collects the symbols a statement may change.
 */
public class CollectChangesVisitor extends StatementExpressionVisitor<RuntimeException> {

	private final Set<Symbol> changes;

	public CollectChangesVisitor(Set<Symbol> changes) {
		this.changes = changes;
	}

	@Override
	protected void visitExpression(Expression expression) {
		expression.collectPossibleWrites(changes);
	}

}
