package tacheck.trans.passes.typecheck;

import tacheck.errors.Issue;
import tacheck.errors.IssueVisitor;
import tacheck.util.SourceLocation;

/**
 * A type error in the model. The detail, if present, names the offending type or construct.
 */
public class TypeCheckingIssue extends Issue {

	public enum Reason {
		PREFIX_URGENT_ONLY_LOCATIONS_AND_CHANNELS("prefix urgent only allowed for locations and channels"),
		PREFIX_BROADCAST_ONLY_CHANNELS("prefix broadcast only allowed for channels"),
		PREFIX_COMMITTED_ONLY_LOCATIONS("prefix committed only allowed for locations"),
		PREFIX_HYBRID_ONLY_CLOCKS("prefix hybrid only allowed for clocks"),
		PREFIX_CONST_NOT_ALLOWED_FOR_CLOCKS("prefix const not allowed for clocks"),
		PREFIX_META_NOT_ALLOWED_FOR_CLOCKS("prefix meta not allowed for clocks"),
		REFERENCE_NOT_ALLOWED("reference to this type not allowed"),
		RANGE_NOT_ALLOWED("range over this type not allowed"),
		INTEGER_EXPECTED("integer expected"),
		MUST_BE_COMPUTABLE_AT_COMPILE_TIME("must be computable at compile time"),
		INVALID_ARRAY_SIZE("invalid array size"),
		NOT_ALLOWED_IN_STRUCT("this type cannot be declared inside a struct"),
		CANNOT_BE_CONST_OR_META("this type cannot be declared const or meta"),
		CHANNEL_EXPECTED("channel expected"),
		INDEX_MUST_BE_SIDE_EFFECT_FREE("index must be side-effect free"),
		CLOCK_EXPECTED("clock expected"),
		CSP_AND_IO_MIXED("CSP and IO synchronisations cannot be mixed"),
		ASSUMED_IO_FOUND_CSP("assumed IO but found CSP synchronisation"),
		ASSUMED_CSP_FOUND_IO("assumed CSP but found IO synchronisation"),
		FREE_PARAMETER_NOT_BOUNDED("free process parameters must be a bounded integer or a scalar"),
		FREE_PARAMETER_RESTRICTED("free process parameters must not be used directly or indirectly in an array declaration or select expression"),
		DYNAMIC_INITIALISER("dynamic constructions cannot be used as initialisers"),
		INITIALISER_MUST_BE_SIDE_EFFECT_FREE("initialiser must be side-effect free"),
		NOT_AN_INVARIANT("expression cannot be used as an invariant"),
		INVARIANT_MUST_BE_SIDE_EFFECT_FREE("invariant must be side-effect free"),
		ONLY_ONE_COST_RATE("only one cost rate is allowed"),
		NUMBER_EXPECTED("number expected"),
		NOT_A_GUARD("expression cannot be used as a guard"),
		GUARD_MUST_BE_SIDE_EFFECT_FREE("guard must be side-effect free"),
		SYNCHRONISATION_MUST_BE_SIDE_EFFECT_FREE("synchronisation must be side-effect free"),
		MESSAGE_MUST_BE_SIDE_EFFECT_FREE("message must be side-effect free"),
		NOT_A_CONDITION("expression cannot be used as a condition"),
		CONDITION_MUST_BE_SIDE_EFFECT_FREE("condition must be side-effect free"),
		PROGRESS_GUARD_NOT_BOOLEAN("progress guard must evaluate to a boolean"),
		PROGRESS_MEASURE_NOT_VALUE("progress measure must evaluate to a value"),
		BOOLEAN_EXPECTED("boolean expected"),
		ARGUMENT_MUST_BE_SIDE_EFFECT_FREE("argument must be side-effect free"),
		INCOMPATIBLE_ARGUMENT("incompatible argument"),
		PROPERTY_MUST_BE_SIDE_EFFECT_FREE("property must be side-effect free"),
		PROPERTY_MUST_BE_VALID_FORMULA("property must be a valid formula"),
		NESTED_PATH_QUANTIFIERS("nesting of path quantifiers is not allowed"),
		MITL_IN_QUANTIFIED_SUB("MITL inside forall or exists in non-MITL property"),
		INVALID_ASSIGNMENT_EXPRESSION("invalid assignment expression"),
		CLOCK_BOUNDS_NOT_WEAK_LOWER_STRICT_UPPER("clock lower bound must be weak and upper bound strict"),
		CLOCK_DIFFERENCES_NOT_SUPPORTED("clock differences are not supported"),
		INVALID_RETURN_TYPE("invalid return type"),
		ASSERTION_MUST_BE_SIDE_EFFECT_FREE("assertion must be side-effect free"),
		SCALAR_SET_OR_INTEGER_EXPECTED("scalar set or integer expected"),
		RANGE_EXPECTED("range expected"),
		FIELD_NAME_IN_ARRAY_INITIALISER("field name not allowed in array initialiser"),
		UNKNOWN_FIELD("unknown field"),
		TOO_MANY_ELEMENTS("too many elements in initialiser"),
		MULTIPLE_INITIALISERS("multiple initialisers for field"),
		INCOMPLETE_INITIALISER("incomplete initialiser"),
		INVALID_INITIALISER("invalid initialiser"),
		INVALID_SUM("a sum can only be made over integer, double, invariant or guard expressions"),
		SPAWN_NON_DYNAMIC("appears as an attempt to spawn a non-dynamic template"),
		WRONG_NUMBER_OF_ARGUMENTS("wrong number of arguments"),
		TEMPLATE_NOT_DEFINED("template is only declared, not defined"),
		NOT_A_DYNAMIC_TEMPLATE("not a dynamic template"),
		EXIT_IN_NON_DYNAMIC_TEMPLATE("exit can only be used in templates declared as dynamic"),
		EXIT_OUTSIDE_TEMPLATE("exit can only be used inside a template"),
		INCOMPATIBLE_TYPES("incompatible types"),
		LEFT_HAND_SIDE_EXPECTED("left hand side value expected"),
		INCREMENT_OPERATOR_MISUSE("increment operator can only be used for integers and cost variables"),
		NON_INTEGER_COMPOUND_ASSIGNMENT("non-integer types must use regular assignment operator"),
		INLINE_IF_CONDITION_NOT_INTEGER("first argument of inline if must be an integer"),
		INCOMPATIBLE_INLINE_IF_ARGUMENTS("incompatible arguments to inline if"),
		INCOMPATIBLE_COMMA_TYPE("incompatible type for comma expression"),
		ARRAY_EXPECTED("array expected"),
		INCOMPATIBLE_INDEX("incompatible type"),
		EXPRESSION_MUST_BE_SIDE_EFFECT_FREE("expression must be side-effect free"),
		COMPOSITION_OF_PROCESSES_EXPECTED("composition of processes expected"),
		LIST_OF_CHANNELS_EXPECTED("list of channels expected"),
		PROCESS_EXPRESSION_EXPECTED("process expression expected"),
		INVALID_RUN_COUNT("invalid run count"),
		EXPLICIT_RUN_COUNT_UNSUPPORTED("explicit number of runs is not supported here"),
		INTEGER_OR_CLOCK_EXPECTED("integer or clock expected"),
		PROBABILITY_BOUND_EXPECTED("floating point number expected as probability bound"),
		MUST_BE_FALSE("must be false"),
		TYPE_ERROR("type error"),
		DYNAMIC_ONLY_ON_EDGES("dynamic constructs are only allowed on edges");

		private final String description;

		Reason(String description) {
			this.description = description;
		}

		public String getDescription() {
			return description;
		}
	}

	private final Reason reason;
	private final SourceLocation location;
	private final String detail;

	public TypeCheckingIssue(Reason reason, SourceLocation location) {
		this(reason, location, null);
	}

	public TypeCheckingIssue(Reason reason, SourceLocation location, String detail) {
		this.reason = reason;
		this.location = location;
		this.detail = detail;
	}

	public Reason getReason() {
		return reason;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public String getDetail() {
		return detail;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
