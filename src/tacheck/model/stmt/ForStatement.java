package tacheck.model.stmt;

import tacheck.model.expr.Expression;
import tacheck.util.SourceLocation;

import java.util.Objects;

/**
 * A C-style for loop. Any of the three header expressions may be absent (null).
 */
public class ForStatement extends Statement {

	private final Expression init;
	private final Expression condition;
	private final Expression step;
	private final Statement body;

	public ForStatement(SourceLocation location, Expression init, Expression condition, Expression step,
	                    Statement body) {
		super(location);
		this.init = init;
		this.condition = condition;
		this.step = step;
		this.body = Objects.requireNonNull(body);
	}

	public Expression getInit() {
		return init;
	}

	public Expression getCondition() {
		return condition;
	}

	public Expression getStep() {
		return step;
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
