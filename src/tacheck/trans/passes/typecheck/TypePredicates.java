package tacheck.trans.passes.typecheck;

import tacheck.model.expr.Expression;
import tacheck.model.expr.ExpressionKind;
import tacheck.model.type.Type;
import tacheck.model.type.TypeKind;

/**
 * Shorthands for testing the inferred type of an already checked expression.
 */
final class TypePredicates {
	private TypePredicates() {}

	static boolean isCost(Expression e) {
		return e.getType().isCost();
	}

	static boolean isVoid(Expression e) {
		return e.getType().isVoid();
	}

	static boolean isDouble(Expression e) {
		return e.getType().isDouble();
	}

	static boolean isInteger(Expression e) {
		return e.getType().isInteger();
	}

	static boolean isBound(Expression e) {
		return e.getType().isInteger() || e.getType().isDouble();
	}

	static boolean isIntegral(Expression e) {
		return e.getType().isIntegral();
	}

	static boolean isClock(Expression e) {
		return e.getType().isClock();
	}

	static boolean isDiff(Expression e) {
		return e.getType().isDiff();
	}

	static boolean isDoubleValue(Expression e) {
		return isDouble(e) || isClock(e) || isDiff(e);
	}

	static boolean isNumber(Expression e) {
		return isDoubleValue(e) || isIntegral(e);
	}

	static boolean isConstantInteger(Expression e) {
		return e.getKind() == ExpressionKind.CONSTANT && isInteger(e);
	}

	static boolean isConstantDouble(Expression e) {
		return e.getKind() == ExpressionKind.CONSTANT && isDouble(e);
	}

	static boolean isInvariant(Expression e) {
		return e.getType().isInvariant();
	}

	static boolean isInvariantWR(Expression e) {
		return e.getType().isInvariantWR();
	}

	static boolean isGuard(Expression e) {
		return e.getType().isGuard();
	}

	static boolean isConstraint(Expression e) {
		return e.getType().isConstraint();
	}

	static boolean isFormula(Expression e) {
		return e.getType().isFormula();
	}

	static boolean isProcessID(Expression e) {
		return e.getKind() == ExpressionKind.IDENTIFIER && e.getType().is(TypeKind.PROCESS);
	}

	static boolean isListOfFormulas(Expression e) {
		if (e.getKind() != ExpressionKind.LIST) {
			return false;
		}
		for (Expression child : e.getChildren()) {
			if (!isFormula(child)) {
				return false;
			}
		}
		return true;
	}

	/**
	 * @return whether e is a list of identifiers of the given kind, e.g. process identifiers
	 */
	static boolean isIDList(Expression e, TypeKind kind) {
		if (e.getKind() != ExpressionKind.LIST) {
			return false;
		}
		for (Expression child : e.getChildren()) {
			if (child.getKind() != ExpressionKind.IDENTIFIER || !child.getType().is(kind)) {
				return false;
			}
		}
		return true;
	}

	// int < clock, clock > int
	static boolean hasStrictLowerBound(Expression e) {
		for (Expression child : e.getChildren()) {
			if (hasStrictLowerBound(child)) {
				return true;
			}
		}
		switch (e.getKind()) {
			case LT:
				return isIntegral(e.get(0)) && isClock(e.get(1));
			case GT:
				return isClock(e.get(0)) && isIntegral(e.get(1));
			default:
				return false;
		}
	}

	// clock < int, int > clock
	static boolean hasStrictUpperBound(Expression e) {
		for (Expression child : e.getChildren()) {
			if (hasStrictUpperBound(child)) {
				return true;
			}
		}
		switch (e.getKind()) {
			case GT:
				return isIntegral(e.get(0)) && isClock(e.get(1));
			case LT:
				return isClock(e.get(0)) && isIntegral(e.get(1));
			default:
				return false;
		}
	}

	/**
	 * Values of assignable types can be assigned: integers, booleans, doubles, clocks, cost,
	 * scalars, and arrays and records of these. Channels and processes are not assignable.
	 */
	static boolean isAssignable(Type type) {
		switch (type.getKind()) {
			case INT:
			case BOOL:
			case DOUBLE:
			case CLOCK:
			case COST:
			case SCALAR:
				return true;
			case ARRAY:
				return isAssignable(type.get(0));
			case RECORD:
				for (int i = 0; i < type.size(); ++i) {
					if (!isAssignable(type.get(i))) {
						return false;
					}
				}
				return true;
			default:
				return type.size() > 0 && isAssignable(type.get(0));
		}
	}

	/**
	 * Functions may return integers, booleans, scalars, doubles and records of these.
	 */
	static boolean isValidReturnType(Type type) {
		switch (type.getKind()) {
			case RECORD:
				for (int i = 0; i < type.size(); ++i) {
					if (!isValidReturnType(type.get(i))) {
						return false;
					}
				}
				return true;
			case RANGE:
			case LABEL:
				return isValidReturnType(type.get(0));
			case INT:
			case BOOL:
			case SCALAR:
			case DOUBLE:
				return true;
			default:
				return false;
		}
	}

}
