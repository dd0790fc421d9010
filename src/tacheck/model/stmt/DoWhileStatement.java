package tacheck.model.stmt;

import tacheck.model.expr.Expression;
import tacheck.util.SourceLocation;

import java.util.Objects;

public class DoWhileStatement extends Statement {

	private final Statement body;
	private final Expression condition;

	public DoWhileStatement(SourceLocation location, Statement body, Expression condition) {
		super(location);
		this.body = Objects.requireNonNull(body);
		this.condition = Objects.requireNonNull(condition);
	}

	public Statement getBody() {
		return body;
	}

	public Expression getCondition() {
		return condition;
	}

	// the body runs at least once
	@Override
	public boolean returns() {
		return body.returns();
	}

	@Override
	public <T, E extends Throwable> T accept(StatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
