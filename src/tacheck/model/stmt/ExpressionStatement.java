package tacheck.model.stmt;

import tacheck.model.expr.Expression;
import tacheck.util.SourceLocation;

import java.util.Objects;

public class ExpressionStatement extends Statement {

	private final Expression expression;

	public ExpressionStatement(SourceLocation location, Expression expression) {
		super(location);
		this.expression = Objects.requireNonNull(expression);
	}

	public Expression getExpression() {
		return expression;
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
