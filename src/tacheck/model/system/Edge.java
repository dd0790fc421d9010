package tacheck.model.system;

import tacheck.model.expr.Expression;
import tacheck.scope.Frame;

/**
 * A transition between two states. Guard, synchronisation and update are optional. The target
 * is absent for edges leading into a branch point.
 */
public class Edge {

	private final State src;
	private final State dst;
	private final boolean control;
	private final Frame select;
	private Expression guard;
	private Expression sync;
	private Expression assign;

	public Edge(State src, State dst, boolean control, Frame select) {
		this.src = src;
		this.dst = dst;
		this.control = control;
		this.select = select;
	}

	public State getSrc() {
		return src;
	}

	public State getDst() {
		return dst;
	}

	public boolean isControllable() {
		return control;
	}

	public Frame getSelect() {
		return select;
	}

	public Expression getGuard() {
		return guard;
	}

	public Edge setGuard(Expression guard) {
		this.guard = guard;
		return this;
	}

	public Expression getSync() {
		return sync;
	}

	public Edge setSync(Expression sync) {
		this.sync = sync;
		return this;
	}

	public Expression getAssign() {
		return assign;
	}

	public Edge setAssign(Expression assign) {
		this.assign = assign;
		return this;
	}

}
