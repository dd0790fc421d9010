package tacheck.model.stmt;

import tacheck.model.expr.Expression;
import tacheck.util.SourceLocation;

import java.util.Objects;

public class WhileStatement extends Statement {

	private final Expression condition;
	private final Statement body;

	public WhileStatement(SourceLocation location, Expression condition, Statement body) {
		super(location);
		this.condition = Objects.requireNonNull(condition);
		this.body = Objects.requireNonNull(body);
	}

	public Expression getCondition() {
		return condition;
	}

	public Statement getBody() {
		return body;
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
