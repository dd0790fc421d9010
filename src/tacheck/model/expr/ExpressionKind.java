package tacheck.model.expr;

public enum ExpressionKind {
	// arithmetic and logic
	PLUS("+"),
	MINUS("-"),
	MULT("*"),
	DIV("/"),
	MOD("%"),
	BIT_AND("&"),
	BIT_OR("|"),
	BIT_XOR("^"),
	BIT_LSHIFT("<<"),
	BIT_RSHIFT(">>"),
	AND("&&"),
	OR("||"),
	XOR("xor"),
	MIN("<?"),
	MAX(">?"),
	RATE("'"),
	FRACTION(":"),

	// floating point library
	ABS_F("abs"),
	FABS_F("fabs"),
	FMOD_F("fmod"),
	FMA_F("fma"),
	FMAX_F("fmax"),
	FMIN_F("fmin"),
	FDIM_F("fdim"),
	EXP_F("exp"),
	EXP2_F("exp2"),
	EXPM1_F("expm1"),
	LN_F("ln"),
	LOG_F("log"),
	LOG10_F("log10"),
	LOG2_F("log2"),
	LOG1P_F("log1p"),
	POW_F("pow"),
	SQRT_F("sqrt"),
	CBRT_F("cbrt"),
	HYPOT_F("hypot"),
	SIN_F("sin"),
	COS_F("cos"),
	TAN_F("tan"),
	ASIN_F("asin"),
	ACOS_F("acos"),
	ATAN_F("atan"),
	ATAN2_F("atan2"),
	SINH_F("sinh"),
	COSH_F("cosh"),
	TANH_F("tanh"),
	ASINH_F("asinh"),
	ACOSH_F("acosh"),
	ATANH_F("atanh"),
	ERF_F("erf"),
	ERFC_F("erfc"),
	TGAMMA_F("tgamma"),
	LGAMMA_F("lgamma"),
	CEIL_F("ceil"),
	FLOOR_F("floor"),
	TRUNC_F("trunc"),
	ROUND_F("round"),
	FINT_F("fint"),
	LDEXP_F("ldexp"),
	ILOGB_F("ilogb"),
	LOGB_F("logb"),
	NEXTAFTER_F("nextafter"),
	COPYSIGN_F("copysign"),
	FPCLASSIFY_F("fpclassify"),
	ISFINITE_F("isfinite"),
	ISINF_F("isinf"),
	ISNAN_F("isnan"),
	ISNORMAL_F("isnormal"),
	SIGNBIT_F("signbit"),
	ISUNORDERED_F("isunordered"),
	RANDOM_F("random"),
	RANDOM_ARCSINE_F("random_arcsine"),
	RANDOM_BETA_F("random_beta"),
	RANDOM_GAMMA_F("random_gamma"),
	RANDOM_NORMAL_F("random_normal"),
	RANDOM_POISSON_F("random_poisson"),
	RANDOM_WEIBULL_F("random_weibull"),
	RANDOM_TRI_F("random_tri"),

	// relations
	LT("<"),
	LE("<="),
	EQ("=="),
	NEQ("!="),
	GE(">="),
	GT(">"),

	// unary
	NOT("!"),
	UNARY_MINUS("-"),
	PREINCREMENT("++"),
	POSTINCREMENT("++"),
	PREDECREMENT("--"),
	POSTDECREMENT("--"),

	// assignment
	ASSIGN("="),
	ASSPLUS("+="),
	ASSMINUS("-="),
	ASSDIV("/="),
	ASSMOD("%="),
	ASSMULT("*="),
	ASSAND("&="),
	ASSOR("|="),
	ASSXOR("^="),
	ASSLSHIFT("<<="),
	ASSRSHIFT(">>="),

	// path formulas and queries
	EF("E<>"),
	EG("E[]"),
	AF("A<>"),
	AG("A[]"),
	LEADSTO("-->"),
	A_UNTIL("A U"),
	A_WEAKUNTIL("A W"),
	A_BUCHI("A[] A<>"),
	EF_R("E<>*"),
	AG_R("A[]*"),
	PMAX("Pmax"),
	PROBAMINBOX("Pr[] min"),
	PROBAMINDIAMOND("Pr<> min"),
	PROBABOX("Pr[]"),
	PROBADIAMOND("Pr<>"),
	PROBAEXP("E"),
	PROBACMP("Pr >= Pr"),
	SIMULATE("simulate"),
	SIMULATEREACH("simulate reach"),
	SUP_VAR("sup"),
	INF_VAR("inf"),
	SCENARIO("scenario"),
	SCENARIO2("scenario2"),

	// controller synthesis
	CONTROL("control:"),
	SMC_CONTROL("control[]"),
	EF_CONTROL("E<> control:"),
	CONTROL_TOPT("control_t*"),
	PO_CONTROL("{} control:"),
	CONTROL_TOPT_DEF1("control_t* def1"),
	CONTROL_TOPT_DEF2("control_t* def2"),

	// timed I/O automata
	RESTRICT("\\"),
	TIOCOMPOSITION("||"),
	TIOCONJUNCTION("&&"),
	TIOQUOTIENT("\\\\"),
	SYNTAX_COMPOSITION("+"),
	CONSISTENCY("consistency:"),
	IMPLEMENTATION("implementation:"),
	SPECIFICATION("specification:"),
	REFINEMENT_LE("<="),
	REFINEMENT_GE(">="),
	SIMULATION_LE("<="),
	SIMULATION_GE(">="),

	// MITL
	MITLFORMULA("mitl"),
	MITLUNTIL("U"),
	MITLRELEASE("R"),
	MITLDISJ("||"),
	MITLCONJ("&&"),
	MITLATOM("atom"),
	MITLNEXT("X"),
	MITLFORALL("forall"),
	MITLEXISTS("exists"),

	// miscellaneous
	IDENTIFIER("identifier"),
	CONSTANT("constant"),
	ARRAY("[]"),
	INLINEIF("?:"),
	COMMA(","),
	DOT("."),
	LIST("{}"),
	FUNCALL("()"),
	SYNC("sync"),
	DEADLOCK("deadlock"),
	FORALL("forall"),
	EXISTS("exists"),
	SUM("sum"),

	// dynamic process creation
	SPAWN("spawn"),
	EXIT("exit"),
	NUMOF("numOf"),
	FORALLDYNAMIC("forall"),
	EXISTSDYNAMIC("exists"),
	SUMDYNAMIC("sum"),
	FOREACHDYNAMIC("foreach");

	private final String symbol;

	ExpressionKind(String symbol) {
		this.symbol = symbol;
	}

	public String getSymbol() {
		return symbol;
	}

	/**
	 * @return whether this is one of the assignment operators =, +=, -= and so on
	 */
	public boolean isAssignment() {
		switch (this) {
			case ASSIGN:
			case ASSPLUS:
			case ASSMINUS:
			case ASSDIV:
			case ASSMOD:
			case ASSMULT:
			case ASSAND:
			case ASSOR:
			case ASSXOR:
			case ASSLSHIFT:
			case ASSRSHIFT:
				return true;
			default:
				return false;
		}
	}

	public boolean isIncrementOrDecrement() {
		switch (this) {
			case PREINCREMENT:
			case POSTINCREMENT:
			case PREDECREMENT:
			case POSTDECREMENT:
				return true;
			default:
				return false;
		}
	}

	public boolean isDynamic() {
		switch (this) {
			case SPAWN:
			case EXIT:
			case NUMOF:
			case FORALLDYNAMIC:
			case EXISTSDYNAMIC:
			case SUMDYNAMIC:
			case FOREACHDYNAMIC:
				return true;
			default:
				return false;
		}
	}

	public boolean isRandom() {
		switch (this) {
			case RANDOM_F:
			case RANDOM_ARCSINE_F:
			case RANDOM_BETA_F:
			case RANDOM_GAMMA_F:
			case RANDOM_NORMAL_F:
			case RANDOM_POISSON_F:
			case RANDOM_WEIBULL_F:
			case RANDOM_TRI_F:
				return true;
			default:
				return false;
		}
	}

	/**
	 * Binary operators are printed infix by {@link Expression#toString()}.
	 */
	public boolean isInfix() {
		switch (this) {
			case PLUS:
			case MINUS:
			case MULT:
			case DIV:
			case MOD:
			case BIT_AND:
			case BIT_OR:
			case BIT_XOR:
			case BIT_LSHIFT:
			case BIT_RSHIFT:
			case AND:
			case OR:
			case XOR:
			case MIN:
			case MAX:
			case FRACTION:
			case LT:
			case LE:
			case EQ:
			case NEQ:
			case GE:
			case GT:
			case LEADSTO:
			case COMMA:
				return true;
			default:
				return isAssignment();
		}
	}
}
