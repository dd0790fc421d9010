package tacheck.model.stmt;

import tacheck.scope.Frame;
import tacheck.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A sequence of statements together with the scope of the variables declared in it. The body of
 * a function is a block whose frame starts with the function's parameters.
 */
public class BlockStatement extends Statement {

	private final Frame frame;
	private final List<Statement> statements;

	public BlockStatement(SourceLocation location, Frame frame, List<Statement> statements) {
		super(location);
		this.frame = Objects.requireNonNull(frame);
		List<Statement> copy = new ArrayList<>(statements.size());
		for (Statement statement : statements) {
			copy.add(Objects.requireNonNull(statement));
		}
		this.statements = Collections.unmodifiableList(copy);
	}

	public Frame getFrame() {
		return frame;
	}

	public List<Statement> getStatements() {
		return statements;
	}

	@Override
	public boolean returns() {
		return !statements.isEmpty() && statements.get(statements.size() - 1).returns();
	}

	@Override
	public <T, E extends Throwable> T accept(StatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
