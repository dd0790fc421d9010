package tacheck.model.stmt;

import tacheck.util.SourceLocatable;
import tacheck.util.SourceLocation;

/**
 * A statement in the body of a function. Statements form a tree: every compound statement owns
 * its children.
 */
public abstract class Statement extends SourceLocatable {

	private final SourceLocation location;

	public Statement(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	/**
	 * @return whether control can never fall off the end of this statement because every path
	 * through it ends in a return
	 */
	public abstract boolean returns();

	public abstract <T, E extends Throwable> T accept(StatementVisitor<T, E> v) throws E;
}
