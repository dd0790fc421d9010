package tacheck.model.stmt;

import tacheck.model.expr.Expression;
import tacheck.util.SourceLocation;

import java.util.Objects;

public class IfStatement extends Statement {

	private final Expression condition;
	private final Statement trueCase;
	// null when there is no else branch
	private final Statement falseCase;

	public IfStatement(SourceLocation location, Expression condition, Statement trueCase, Statement falseCase) {
		super(location);
		this.condition = Objects.requireNonNull(condition);
		this.trueCase = Objects.requireNonNull(trueCase);
		this.falseCase = falseCase;
	}

	public Expression getCondition() {
		return condition;
	}

	public Statement getTrueCase() {
		return trueCase;
	}

	public Statement getFalseCase() {
		return falseCase;
	}

	/**
	 * An if without an else never returns, even when its true branch always does. Downstream
	 * reasoning about missing returns relies on this conservative answer.
	 */
	@Override
	public boolean returns() {
		return trueCase.returns() && falseCase != null && falseCase.returns();
	}

	@Override
	public <T, E extends Throwable> T accept(StatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
