package tacheck.model.stmt;

import tacheck.model.expr.Expression;
import tacheck.scope.Frame;
import tacheck.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class CaseStatement extends BlockStatement {

	private final Expression condition;

	public CaseStatement(SourceLocation location, Frame frame, Expression condition, List<Statement> statements) {
		super(location, frame, statements);
		this.condition = Objects.requireNonNull(condition);
	}

	public Expression getCondition() {
		return condition;
	}

	@Override
	public boolean returns() {
		return false;
	}

	@Override
	public <T, E extends Throwable> T accept(StatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
