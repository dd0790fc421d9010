package tacheck.model.stmt;

import tacheck.util.SourceLocation;

public class EmptyStatement extends Statement {

	public EmptyStatement(SourceLocation location) {
		super(location);
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
