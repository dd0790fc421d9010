package tacheck.model.stmt;

/**
 * A statement visitor that does nothing for simple statements and descends into the children of
 * compound ones, in source order. Switch, case and default statements are visited as blocks.
 */
public class DescendingStatementVisitor<E extends Throwable> extends StatementVisitor<Void, E> {

	@Override
	public Void visit(EmptyStatement emptyStatement) throws E {
		return null;
	}

	@Override
	public Void visit(ExpressionStatement expressionStatement) throws E {
		return null;
	}

	@Override
	public Void visit(AssertStatement assertStatement) throws E {
		return null;
	}

	@Override
	public Void visit(ForStatement forStatement) throws E {
		return forStatement.getBody().accept(this);
	}

	@Override
	public Void visit(IterationStatement iterationStatement) throws E {
		return iterationStatement.getBody().accept(this);
	}

	@Override
	public Void visit(WhileStatement whileStatement) throws E {
		return whileStatement.getBody().accept(this);
	}

	@Override
	public Void visit(DoWhileStatement doWhileStatement) throws E {
		return doWhileStatement.getBody().accept(this);
	}

	@Override
	public Void visit(BlockStatement blockStatement) throws E {
		for (Statement statement : blockStatement.getStatements()) {
			statement.accept(this);
		}
		return null;
	}

	@Override
	public Void visit(SwitchStatement switchStatement) throws E {
		return visit((BlockStatement) switchStatement);
	}

	@Override
	public Void visit(CaseStatement caseStatement) throws E {
		return visit((BlockStatement) caseStatement);
	}

	@Override
	public Void visit(DefaultStatement defaultStatement) throws E {
		return visit((BlockStatement) defaultStatement);
	}

	@Override
	public Void visit(IfStatement ifStatement) throws E {
		ifStatement.getTrueCase().accept(this);
		if (ifStatement.getFalseCase() != null) {
			ifStatement.getFalseCase().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(BreakStatement breakStatement) throws E {
		return null;
	}

	@Override
	public Void visit(ContinueStatement continueStatement) throws E {
		return null;
	}

	@Override
	public Void visit(ReturnStatement returnStatement) throws E {
		return null;
	}

}
