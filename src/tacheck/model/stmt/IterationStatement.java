package tacheck.model.stmt;

import tacheck.scope.Frame;
import tacheck.scope.Symbol;
import tacheck.util.SourceLocation;

import java.util.Objects;

/**
 * for (i : T) body, iterating i over every value of the range or scalar set type T.
 */
public class IterationStatement extends Statement {

	private final Symbol symbol;
	private final Frame frame;
	private final Statement body;

	public IterationStatement(SourceLocation location, Symbol symbol, Frame frame, Statement body) {
		super(location);
		this.symbol = Objects.requireNonNull(symbol);
		this.frame = Objects.requireNonNull(frame);
		this.body = Objects.requireNonNull(body);
	}

	public Symbol getSymbol() {
		return symbol;
	}

	public Frame getFrame() {
		return frame;
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
