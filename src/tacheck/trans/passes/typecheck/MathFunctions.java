package tacheck.trans.passes.typecheck;

import tacheck.model.expr.ExpressionKind;
import tacheck.model.type.TypeKind;

/**
 * Argument and result types of the built-in floating point library.
 */
final class MathFunctions {
	private MathFunctions() {}

	static final class Signature {
		private final TypeKind result;
		private final int arity;
		// bit i is set if argument i must be integral rather than any number
		private final int integerArguments;

		Signature(TypeKind result, int arity, int integerArguments) {
			this.result = result;
			this.arity = arity;
			this.integerArguments = integerArguments;
		}

		TypeKind getResult() {
			return result;
		}

		int getArity() {
			return arity;
		}

		boolean isIntegerArgument(int i) {
			return (integerArguments & (1 << i)) != 0;
		}
	}

	private static final Signature UNARY_DOUBLE = new Signature(TypeKind.DOUBLE, 1, 0);
	private static final Signature BINARY_DOUBLE = new Signature(TypeKind.DOUBLE, 2, 0);
	private static final Signature TERNARY_DOUBLE = new Signature(TypeKind.DOUBLE, 3, 0);
	private static final Signature INTEGER_TO_INTEGER = new Signature(TypeKind.INT, 1, 0b1);
	private static final Signature NUMBER_TO_INTEGER = new Signature(TypeKind.INT, 1, 0);
	private static final Signature CLASSIFICATION = new Signature(TypeKind.BOOL, 1, 0);
	private static final Signature LDEXP = new Signature(TypeKind.DOUBLE, 2, 0b10);
	private static final Signature UNORDERED = new Signature(TypeKind.BOOL, 2, 0);

	static boolean isMathFunction(ExpressionKind kind) {
		return signatureOf(kind) != null;
	}

	/**
	 * @return the signature of a library function, or null if kind is not one
	 */
	static Signature signatureOf(ExpressionKind kind) {
		switch (kind) {
			case FMA_F:
			case RANDOM_TRI_F:
				return TERNARY_DOUBLE;
			case FMOD_F:
			case FMAX_F:
			case FMIN_F:
			case FDIM_F:
			case POW_F:
			case HYPOT_F:
			case ATAN2_F:
			case NEXTAFTER_F:
			case COPYSIGN_F:
			case RANDOM_ARCSINE_F:
			case RANDOM_BETA_F:
			case RANDOM_GAMMA_F:
			case RANDOM_NORMAL_F:
			case RANDOM_WEIBULL_F:
				return BINARY_DOUBLE;
			case FABS_F:
			case EXP_F:
			case EXP2_F:
			case EXPM1_F:
			case LN_F:
			case LOG_F:
			case LOG10_F:
			case LOG2_F:
			case LOG1P_F:
			case SQRT_F:
			case CBRT_F:
			case SIN_F:
			case COS_F:
			case TAN_F:
			case ASIN_F:
			case ACOS_F:
			case ATAN_F:
			case SINH_F:
			case COSH_F:
			case TANH_F:
			case ASINH_F:
			case ACOSH_F:
			case ATANH_F:
			case ERF_F:
			case ERFC_F:
			case TGAMMA_F:
			case LGAMMA_F:
			case CEIL_F:
			case FLOOR_F:
			case TRUNC_F:
			case ROUND_F:
			case LOGB_F:
			case RANDOM_F:
			case RANDOM_POISSON_F:
				return UNARY_DOUBLE;
			case LDEXP_F:
				return LDEXP;
			case ABS_F:
			case FPCLASSIFY_F:
				return INTEGER_TO_INTEGER;
			case ILOGB_F:
			case FINT_F:
				return NUMBER_TO_INTEGER;
			case ISFINITE_F:
			case ISINF_F:
			case ISNAN_F:
			case ISNORMAL_F:
			case SIGNBIT_F:
				return CLASSIFICATION;
			case ISUNORDERED_F:
				return UNORDERED;
			default:
				return null;
		}
	}
}
