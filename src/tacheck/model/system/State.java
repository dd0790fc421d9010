package tacheck.model.system;

import tacheck.model.expr.Expression;
import tacheck.scope.Symbol;

/**
 * A location of a template. Type checking splits the declared invariant into the clock
 * invariant proper and an optional cost rate.
 */
public class State {

	private final Symbol uid;
	private Expression invariant;
	private Expression costRate;
	private final Expression exponentialRate;

	public State(Symbol uid, Expression invariant, Expression exponentialRate) {
		this.uid = uid;
		this.invariant = invariant;
		this.exponentialRate = exponentialRate;
	}

	public Symbol getUid() {
		return uid;
	}

	public Expression getInvariant() {
		return invariant;
	}

	public void setInvariant(Expression invariant) {
		this.invariant = invariant;
	}

	public Expression getCostRate() {
		return costRate;
	}

	public void setCostRate(Expression costRate) {
		this.costRate = costRate;
	}

	public Expression getExponentialRate() {
		return exponentialRate;
	}

	@Override
	public String toString() {
		return uid.getName();
	}

}
