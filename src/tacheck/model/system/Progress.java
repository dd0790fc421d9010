package tacheck.model.system;

import tacheck.model.expr.Expression;

public class Progress {

	private final Expression guard;
	private final Expression measure;

	public Progress(Expression guard, Expression measure) {
		this.guard = guard;
		this.measure = measure;
	}

	public Expression getGuard() {
		return guard;
	}

	public Expression getMeasure() {
		return measure;
	}

}
