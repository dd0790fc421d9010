package tacheck.trans.passes.typecheck;

import tacheck.model.type.Type;
import tacheck.model.type.TypeKind;

import java.util.Objects;

/**
 * Compatibility relations between types. None of these look at the expressions a type came
 * from, except through the bounds of ranges, which are compared structurally.
 */
public final class TypeCompatibility {
	private TypeCompatibility() {}

	/**
	 * Urgent channels have capability 0, non-urgent broadcast channels 1, all other channels 2.
	 * An argument to a channel parameter must have at least the capability of the parameter.
	 */
	public static int channelCapability(Type type) {
		if (!type.isChannel()) {
			throw new IllegalArgumentException("channel expected, found " + type);
		}
		if (type.is(TypeKind.URGENT)) {
			return 0;
		}
		if (type.is(TypeKind.BROADCAST)) {
			return 1;
		}
		return 2;
	}

	private static boolean isQualifier(Type t) {
		TypeKind kind = t.getKind();
		return kind == TypeKind.REF || kind == TypeKind.CONSTANT || kind == TypeKind.SYSTEM_META;
	}

	private static boolean sameBounds(Type a, Type b) {
		if (!a.isRange() || !b.isRange()) {
			return !a.isRange() && !b.isRange();
		}
		return Objects.equals(a.getLowerBound(), b.getLowerBound()) &&
				Objects.equals(a.getUpperBound(), b.getUpperBound());
	}

	/**
	 * Scalar sets use name equivalence: two scalar types are the same if they carry the same
	 * type names and ranges, ignoring ref, const and meta.
	 */
	public static boolean isSameScalarType(Type t1, Type t2) {
		if (isQualifier(t1)) {
			return isSameScalarType(t1.get(0), t2);
		} else if (isQualifier(t2)) {
			return isSameScalarType(t1, t2.get(0));
		} else if (t1.getKind() == TypeKind.LABEL && t2.getKind() == TypeKind.LABEL) {
			return t1.getLabel(0).equals(t2.getLabel(0)) && isSameScalarType(t1.get(0), t2.get(0));
		} else if (t1.getKind() == TypeKind.SCALAR && t2.getKind() == TypeKind.SCALAR) {
			return true;
		} else if (t1.getKind() == TypeKind.RANGE && t2.getKind() == TypeKind.RANGE) {
			return isSameScalarType(t1.get(0), t2.get(0)) && sameBounds(t1, t2);
		}
		return false;
	}

	/**
	 * Structural equivalence ignoring const, meta and ref. Scalar sets are compared by name.
	 */
	public static boolean areEquivalent(Type a, Type b) {
		if (a.isInteger() && b.isInteger()) {
			return !a.isRange() || !b.isRange() || sameBounds(a, b);
		} else if (a.isBoolean() && b.isBoolean()) {
			return true;
		} else if (a.isClock() && b.isClock()) {
			return true;
		} else if (a.isChannel() && b.isChannel()) {
			return channelCapability(a) == channelCapability(b);
		} else if (a.isRecord() && b.isRecord()) {
			int size = a.getRecordSize();
			if (size != b.getRecordSize()) {
				return false;
			}
			for (int i = 0; i < size; ++i) {
				if (!a.getRecordLabel(i).equals(b.getRecordLabel(i)) || !areEquivalent(a.getSub(i), b.getSub(i))) {
					return false;
				}
			}
			return true;
		} else if (a.isArray() && b.isArray()) {
			Type aSize = a.getArraySize();
			Type bSize = b.getArraySize();
			if (aSize.isInteger() && bSize.isInteger()) {
				return sameBounds(aSize, bSize) && areEquivalent(a.getSub(), b.getSub());
			} else if (aSize.isScalar() && bSize.isScalar()) {
				return isSameScalarType(aSize, bSize) && areEquivalent(a.getSub(), b.getSub());
			}
			return false;
		} else if (a.isScalar() && b.isScalar()) {
			return isSameScalarType(a, b);
		} else if (a.isDouble() && b.isDouble()) {
			return true;
		}
		return false;
	}

	/**
	 * Whether a value of type rvalue can be assigned to a location of type lvalue. Does not
	 * check that the location is an lvalue, nor integer ranges.
	 *
	 * @param init whether this is an initialiser, where a clock may be initialised with a double
	 */
	public static boolean areAssignmentCompatible(Type lvalue, Type rvalue, boolean init) {
		if (init
				? lvalue.isClock() && rvalue.isDouble()
				: (lvalue.isClock() || lvalue.isDouble()) &&
				(rvalue.isIntegral() || rvalue.isDouble() || rvalue.isClock())) {
			return true;
		} else if (lvalue.isIntegral() && rvalue.isIntegral()) {
			return true;
		}
		return areEquivalent(lvalue, rvalue);
	}

	public static boolean areAssignmentCompatible(Type lvalue, Type rvalue) {
		return areAssignmentCompatible(lvalue, rvalue, false);
	}

	/**
	 * Whether two types can be compared with == and !=. Clocks are not handled here.
	 */
	public static boolean areEqCompatible(Type t1, Type t2) {
		if (t1.isIntegral() && t2.isIntegral()) {
			return true;
		} else if (t1.is(TypeKind.PROCESSVAR) && t2.is(TypeKind.PROCESSVAR)) {
			return true;
		}
		return areEquivalent(t1, t2);
	}

	/**
	 * The branches of an inline if are compatible if both are integral or they are equivalent.
	 */
	public static boolean areInlineIfCompatible(Type t1, Type t2) {
		if (t1.isIntegral() && t2.isIntegral()) {
			return true;
		}
		return areEquivalent(t1, t2);
	}

}
