package tacheck.model.stmt;

import tacheck.model.expr.Expression;
import tacheck.model.system.Variable;
import tacheck.scope.Symbol;

/**
 * Walks a statement tree like {@link DescendingStatementVisitor} and additionally hands every
 * expression found along the way to {@link #visitExpression(Expression)}: conditions, loop
 * headers, return values, and for blocks the initialisers of the variables declared in them
 * (before any of the block's statements). Absent expressions are skipped.
 */
public abstract class StatementExpressionVisitor<E extends Throwable> extends DescendingStatementVisitor<E> {

	protected abstract void visitExpression(Expression expression) throws E;

	private void visitIfPresent(Expression expression) throws E {
		if (expression != null) {
			visitExpression(expression);
		}
	}

	@Override
	public Void visit(ExpressionStatement expressionStatement) throws E {
		visitExpression(expressionStatement.getExpression());
		return null;
	}

	@Override
	public Void visit(AssertStatement assertStatement) throws E {
		visitExpression(assertStatement.getExpression());
		return null;
	}

	@Override
	public Void visit(ForStatement forStatement) throws E {
		visitIfPresent(forStatement.getInit());
		visitIfPresent(forStatement.getCondition());
		visitIfPresent(forStatement.getStep());
		return forStatement.getBody().accept(this);
	}

	@Override
	public Void visit(WhileStatement whileStatement) throws E {
		visitExpression(whileStatement.getCondition());
		return whileStatement.getBody().accept(this);
	}

	@Override
	public Void visit(DoWhileStatement doWhileStatement) throws E {
		visitExpression(doWhileStatement.getCondition());
		return doWhileStatement.getBody().accept(this);
	}

	@Override
	public Void visit(BlockStatement blockStatement) throws E {
		for (Symbol symbol : blockStatement.getFrame().getSymbols()) {
			if (symbol.getData() instanceof Variable) {
				visitIfPresent(((Variable) symbol.getData()).getInit());
			}
		}
		return super.visit(blockStatement);
	}

	@Override
	public Void visit(SwitchStatement switchStatement) throws E {
		visitExpression(switchStatement.getCondition());
		return visit((BlockStatement) switchStatement);
	}

	@Override
	public Void visit(CaseStatement caseStatement) throws E {
		visitExpression(caseStatement.getCondition());
		return visit((BlockStatement) caseStatement);
	}

	@Override
	public Void visit(IfStatement ifStatement) throws E {
		visitExpression(ifStatement.getCondition());
		return super.visit(ifStatement);
	}

	@Override
	public Void visit(ReturnStatement returnStatement) throws E {
		visitIfPresent(returnStatement.getValue());
		return null;
	}

}
