package tacheck.model.stmt;

import tacheck.scope.Frame;
import tacheck.util.SourceLocation;

import java.util.List;

public class DefaultStatement extends BlockStatement {

	public DefaultStatement(SourceLocation location, Frame frame, List<Statement> statements) {
		super(location, frame, statements);
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
