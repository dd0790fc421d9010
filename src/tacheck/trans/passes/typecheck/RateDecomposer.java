package tacheck.trans.passes.typecheck;

import tacheck.InternalCompilerError;
import tacheck.model.expr.Expression;
import tacheck.model.expr.ExpressionBuilder;
import tacheck.model.expr.ExpressionKind;
import tacheck.model.type.Type;
import tacheck.model.type.TypeKind;

/**
 * Splits a checked state invariant into the invariant proper and a cost rate. Rate equations
 * on clocks stay part of the invariant and mark the state as having stopwatches.
 *
 * Use one decomposer per invariant.
 */
public class RateDecomposer {

	private Expression invariant = null;
	private Expression costRate = null;
	private boolean hasStrictInvariant = false;
	private boolean hasClockRates = false;
	private int countCostRates = 0;

	/**
	 * @param expr an expression of type invariant or invariant with rates
	 */
	public void decompose(Expression expr) {
		decompose(expr, false);
	}

	private void decompose(Expression expr, boolean inForall) {
		if (!expr.getType().isInvariantWR()) {
			throw new InternalCompilerError("decomposing non-invariant " + expr);
		}
		if (expr.getType().isInvariant()) {
			// strict upper bounds only
			if (expr.getKind() == ExpressionKind.LT) {
				hasStrictInvariant = true;
			}
			if (!inForall) {
				accumulate(expr, TypeKind.INVARIANT);
			}
		} else if (expr.getKind() == ExpressionKind.AND) {
			decompose(expr.get(0), inForall);
			decompose(expr.get(1), inForall);
		} else if (expr.getKind() == ExpressionKind.EQ) {
			Expression left;
			Expression right;
			boolean leftIsRate = expr.get(0).getType().getKind() == TypeKind.RATE;
			boolean rightIsRate = expr.get(1).getType().getKind() == TypeKind.RATE;
			if (leftIsRate == rightIsRate) {
				throw new InternalCompilerError("rate equation needs exactly one rate: " + expr);
			}
			if (leftIsRate) {
				left = expr.get(0).get(0);
				right = expr.get(1);
			} else {
				left = expr.get(1).get(0);
				right = expr.get(0);
			}
			if (left.getType().isCost()) {
				costRate = right;
				countCostRates++;
			} else {
				hasClockRates = true;
				if (!inForall) {
					accumulate(expr, TypeKind.INVARIANT_WR);
				}
			}
		} else if (expr.getKind() == ExpressionKind.FORALL || expr.getKind() == ExpressionKind.FORALLDYNAMIC) {
			// look inside for clock rates, but keep the quantified invariant whole
			decompose(expr.get(expr.getSize() - 1), true);
			if (!inForall) {
				accumulate(expr, TypeKind.INVARIANT_WR);
			}
		} else if (!inForall) {
			accumulate(expr, TypeKind.INVARIANT_WR);
		}
	}

	private void accumulate(Expression expr, TypeKind kind) {
		if (invariant == null) {
			invariant = expr;
			return;
		}
		if (!invariant.getType().isInvariant()) {
			kind = TypeKind.INVARIANT_WR;
		}
		invariant = Expression.createBinary(ExpressionKind.AND, invariant, expr, expr.getLocation(),
				Type.primitive(kind));
	}

	/**
	 * @return the invariant without cost rates, the constant true if nothing remains
	 */
	public Expression getInvariant() {
		return invariant == null ? ExpressionBuilder.bool(true) : invariant;
	}

	/**
	 * @return the cost rate, or null if the invariant had none
	 */
	public Expression getCostRate() {
		return costRate;
	}

	public boolean hasStrictInvariant() {
		return hasStrictInvariant;
	}

	public boolean hasClockRates() {
		return hasClockRates;
	}

	public int getCountCostRates() {
		return countCostRates;
	}

}
