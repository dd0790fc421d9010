package tacheck.model.stmt;

import tacheck.model.expr.Expression;
import tacheck.util.SourceLocation;

public class ReturnStatement extends Statement {

	// null for a plain "return;"
	private final Expression value;

	public ReturnStatement(SourceLocation location, Expression value) {
		super(location);
		this.value = value;
	}

	public Expression getValue() {
		return value;
	}

	@Override
	public boolean returns() {
		return true;
	}

	@Override
	public <T, E extends Throwable> T accept(StatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
