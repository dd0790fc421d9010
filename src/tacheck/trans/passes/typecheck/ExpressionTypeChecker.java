package tacheck.trans.passes.typecheck;

import tacheck.errors.IssueContext;
import tacheck.model.expr.Expression;
import tacheck.model.expr.ExpressionKind;
import tacheck.model.system.Template;
import tacheck.model.system.TimedAutomataSystem;
import tacheck.model.type.Type;
import tacheck.model.type.TypeKind;
import tacheck.scope.Frame;
import tacheck.scope.Symbol;
import tacheck.util.SourceLocatable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static tacheck.trans.passes.typecheck.TypePredicates.*;
import static tacheck.trans.passes.typecheck.TypeCompatibility.*;

/**
 * Infers and checks the types of expressions, and checks the legality of declared types.
 *
 * Every successfully checked expression has its inferred type stored on it. On failure an issue
 * is reported and the type is left untouched; callers must then not rely on it. Checking an
 * expression that has already been checked yields the same type again.
 *
 * An instance is not thread safe, and two instances must not check expressions shared between
 * them at the same time, since the inferred types are stored on the shared nodes.
 */
public class ExpressionTypeChecker {

	private final TimedAutomataSystem system;
	private final CompileTimeComputableValues computable;
	private IssueContext ctx;
	private Template template = null;

	public ExpressionTypeChecker(TimedAutomataSystem system, CompileTimeComputableValues computable,
	                             IssueContext ctx) {
		this.system = system;
		this.computable = computable;
		this.ctx = ctx;
	}

	void setIssueContext(IssueContext ctx) {
		this.ctx = ctx;
	}

	/**
	 * Sets the template whose contents are currently being checked, which decides whether exit
	 * is allowed. null outside of templates.
	 */
	void setTemplate(Template template) {
		this.template = template;
	}

	void error(TypeCheckingIssue.Reason reason, SourceLocatable where) {
		ctx.error(new TypeCheckingIssue(reason, where.getLocation()));
	}

	void error(TypeCheckingIssue.Reason reason, SourceLocatable where, String detail) {
		ctx.error(new TypeCheckingIssue(reason, where.getLocation(), detail));
	}

	void warning(TypeCheckingWarning.Reason reason, SourceLocatable where) {
		ctx.warning(new TypeCheckingWarning(reason, where.getLocation()));
	}

	private void bug(InternalConsistencyIssue.Reason reason, SourceLocatable where) {
		ctx.error(new InternalConsistencyIssue(reason, where.getLocation()));
	}

	/**
	 * An expression is compile time computable if every symbol it may read during evaluation,
	 * including through function calls, has a value known at compile time. Functions themselves
	 * are fine. Expressions drawing random numbers never are.
	 */
	public boolean isCompileTimeComputable(Expression expr) {
		return isCompileTimeComputable(expr, null);
	}

	/**
	 * @param extra additional symbols to consider computable, e.g. the select variables of an
	 *              edge, or null
	 */
	public boolean isCompileTimeComputable(Expression expr, Frame extra) {
		if (expr.dependsOnRandom()) {
			return false;
		}
		Set<Symbol> reads = new HashSet<>();
		expr.collectPossibleReads(reads);
		for (Symbol symbol : reads) {
			if (symbol.getType().isFunction() || computable.contains(symbol)) {
				continue;
			}
			if (extra != null && extra.contains(symbol)) {
				continue;
			}
			return false;
		}
		return true;
	}

	public void checkType(Type type) {
		checkType(type, false, false);
	}

	/**
	 * Checks that only allowed prefixes are used, that range bounds and array sizes are
	 * computable integers, and, if initialisable is set, that the type can be initialised.
	 */
	public void checkType(Type type, boolean initialisable, boolean inStruct) {
		switch (type.getKind()) {
			case LABEL:
				checkType(type.get(0), initialisable, inStruct);
				break;
			case URGENT:
				if (!type.isLocation() && !type.isChannel()) {
					error(TypeCheckingIssue.Reason.PREFIX_URGENT_ONLY_LOCATIONS_AND_CHANNELS, type);
				}
				checkType(type.get(0), initialisable, inStruct);
				break;
			case BROADCAST:
				if (!type.isChannel()) {
					error(TypeCheckingIssue.Reason.PREFIX_BROADCAST_ONLY_CHANNELS, type);
				}
				checkType(type.get(0), initialisable, inStruct);
				break;
			case COMMITTED:
				if (!type.isLocation()) {
					error(TypeCheckingIssue.Reason.PREFIX_COMMITTED_ONLY_LOCATIONS, type);
				}
				checkType(type.get(0), initialisable, inStruct);
				break;
			case HYBRID:
				if (!type.isClock() && !(type.isArray() && type.stripArray().isClock())) {
					error(TypeCheckingIssue.Reason.PREFIX_HYBRID_ONLY_CLOCKS, type);
				}
				checkType(type.get(0), initialisable, inStruct);
				break;
			case CONSTANT:
				if (type.isClock()) {
					error(TypeCheckingIssue.Reason.PREFIX_CONST_NOT_ALLOWED_FOR_CLOCKS, type);
				}
				checkType(type.get(0), true, inStruct);
				break;
			case SYSTEM_META:
				if (type.isClock()) {
					error(TypeCheckingIssue.Reason.PREFIX_META_NOT_ALLOWED_FOR_CLOCKS, type);
				}
				checkType(type.get(0), true, inStruct);
				break;
			case REF:
				if (!type.isIntegral() && !type.isArray() && !type.isRecord() && !type.isChannel() &&
						!type.isClock() && !type.isScalar() && !type.isDouble()) {
					error(TypeCheckingIssue.Reason.REFERENCE_NOT_ALLOWED, type, type.toString());
				}
				checkType(type.get(0), initialisable, inStruct);
				break;
			case RANGE:
				if (!type.isInteger() && !type.isScalar()) {
					error(TypeCheckingIssue.Reason.RANGE_NOT_ALLOWED, type, type.toString());
				}
				checkRangeBound(type.getLowerBound());
				checkRangeBound(type.getUpperBound());
				break;
			case ARRAY:
				Type size = type.getArraySize();
				if (!size.is(TypeKind.RANGE)) {
					error(TypeCheckingIssue.Reason.INVALID_ARRAY_SIZE, type);
				} else {
					checkType(size);
				}
				checkType(type.get(0), initialisable, inStruct);
				break;
			case RECORD:
				for (int i = 0; i < type.getRecordSize(); ++i) {
					checkType(type.getSub(i), true, true);
				}
				break;
			case DOUBLE:
				if (inStruct) {
					error(TypeCheckingIssue.Reason.NOT_ALLOWED_IN_STRUCT, type, type.toString());
				}
				break;
			case INT:
			case BOOL:
				break;
			default:
				if (initialisable) {
					error(TypeCheckingIssue.Reason.CANNOT_BE_CONST_OR_META, type, type.toString());
				}
		}
	}

	private void checkRangeBound(Expression bound) {
		if (bound == null || !checkExpression(bound)) {
			return;
		}
		if (!isInteger(bound)) {
			error(TypeCheckingIssue.Reason.INTEGER_EXPECTED, bound);
		}
		if (!isCompileTimeComputable(bound)) {
			error(TypeCheckingIssue.Reason.MUST_BE_COMPUTABLE_AT_COMPILE_TIME, bound);
		}
	}

	/**
	 * Checks the expression and all its sub-expressions, storing the inferred type on each.
	 * Absent (null) expressions are valid. Sub-expressions are checked first; if any of them
	 * fails, the expression itself is not checked, so that one mistake yields one issue.
	 *
	 * Integer ranges are not checked.
	 *
	 * @return whether no issue was found
	 */
	public boolean checkExpression(Expression expr) {
		if (expr == null) {
			return true;
		}

		boolean ok = true;
		for (Expression child : expr.getChildren()) {
			ok &= checkExpression(child);
		}
		if (!ok) {
			return false;
		}

		Type type;
		switch (expr.getKind()) {
			case IDENTIFIER:
			case CONSTANT:
			case DOT:
			case SYNC:
			case DEADLOCK:
			case FORALLDYNAMIC:
			case EXISTSDYNAMIC:
			case FOREACHDYNAMIC:
				// typed when built
				return true;
			case LIST:
				type = listType(expr);
				break;
			case FUNCALL:
				return checkFunctionCall(expr);
			case PLUS:
			case MINUS:
			case MULT:
			case DIV:
			case MIN:
			case MAX:
			case MOD:
			case BIT_AND:
			case BIT_OR:
			case BIT_XOR:
			case BIT_LSHIFT:
			case BIT_RSHIFT:
			case FRACTION:
			case UNARY_MINUS:
			case RATE:
				type = arithmeticType(expr);
				break;
			case AND:
			case OR:
			case XOR:
			case NOT:
				type = logicalType(expr);
				break;
			case EQ:
			case NEQ:
			case LT:
			case LE:
			case GT:
			case GE:
				type = comparisonType(expr);
				break;
			case INLINEIF:
				type = inlineIfType(expr);
				break;
			case COMMA:
				type = commaType(expr);
				break;
			case ARRAY:
				type = indexType(expr);
				break;
			case FORALL:
			case EXISTS:
			case SUM:
			case SUMDYNAMIC:
				type = quantifierType(expr);
				break;
			case SPAWN:
			case NUMOF:
			case EXIT:
				type = dynamicType(expr);
				break;
			default:
				if (expr.getKind().isAssignment() || expr.getKind().isIncrementOrDecrement()) {
					type = assignmentType(expr);
				} else if (MathFunctions.isMathFunction(expr.getKind())) {
					type = mathFunctionType(expr);
				} else {
					type = propertyType(expr);
				}
		}

		if (type == null) {
			// already reported
			return false;
		}
		if (type.isUnknown()) {
			error(TypeCheckingIssue.Reason.TYPE_ERROR, expr);
			return false;
		}
		expr.setType(type);
		return true;
	}

	private static Type primitive(TypeKind kind) {
		return Type.primitive(kind);
	}

	/**
	 * A list literal is typed as a record of the types of its entries, keeping entry labels.
	 */
	private static Type listType(Expression expr) {
		List<Type> types = new ArrayList<>(expr.getSize());
		List<String> labels = new ArrayList<>(expr.getSize());
		Type current = expr.getType();
		for (int i = 0; i < expr.getSize(); ++i) {
			types.add(expr.get(i).getType());
			boolean labelled = current.getKind() == TypeKind.RECORD && i < current.size();
			labels.add(labelled ? current.getLabel(i) : "");
		}
		return Type.record(types, labels);
	}

	private boolean checkFunctionCall(Expression expr) {
		Type function = expr.get(0).getType();
		if (!function.isFunction()) {
			error(TypeCheckingIssue.Reason.TYPE_ERROR, expr.get(0), function.toString());
			return false;
		}
		int parameters = function.size() - 1;
		if (expr.getSize() - 1 != parameters) {
			error(TypeCheckingIssue.Reason.WRONG_NUMBER_OF_ARGUMENTS, expr);
			return false;
		}
		boolean result = true;
		for (int i = 0; i < parameters; ++i) {
			result &= checkParameterCompatible(function.get(i + 1), expr.get(i + 1));
		}
		return result;
	}

	private Type arithmeticType(Expression expr) {
		Expression left = expr.get(0);
		switch (expr.getKind()) {
			case PLUS: {
				Expression right = expr.get(1);
				if (isIntegral(left) && isIntegral(right)) {
					return primitive(TypeKind.INT);
				} else if ((isInteger(left) && isClock(right)) || (isClock(left) && isInteger(right))) {
					return primitive(TypeKind.CLOCK);
				} else if ((isDiff(left) && isInteger(right)) || (isInteger(left) && isDiff(right))) {
					return primitive(TypeKind.DIFF);
				} else if (isNumber(left) && isNumber(right)) {
					return primitive(TypeKind.DOUBLE);
				}
				return Type.unknown();
			}
			case MINUS: {
				Expression right = expr.get(1);
				if (isIntegral(left) && isIntegral(right)) {
					return primitive(TypeKind.INT);
				} else if (isClock(left) && isInteger(right)) {
					// not int - clock, which would not convert into a clock guard
					return primitive(TypeKind.CLOCK);
				} else if ((isDiff(left) && isInteger(right)) || (isInteger(left) && isDiff(right)) ||
						(isClock(left) && isClock(right))) {
					return primitive(TypeKind.DIFF);
				} else if (isNumber(left) && isNumber(right)) {
					return primitive(TypeKind.DOUBLE);
				}
				return Type.unknown();
			}
			case MULT:
			case DIV:
			case MIN:
			case MAX: {
				Expression right = expr.get(1);
				if (isIntegral(left) && isIntegral(right)) {
					return primitive(TypeKind.INT);
				} else if (isNumber(left) && isNumber(right)) {
					return primitive(TypeKind.DOUBLE);
				}
				return Type.unknown();
			}
			case MOD:
			case BIT_AND:
			case BIT_OR:
			case BIT_XOR:
			case BIT_LSHIFT:
			case BIT_RSHIFT:
				if (isIntegral(left) && isIntegral(expr.get(1))) {
					return primitive(TypeKind.INT);
				}
				return Type.unknown();
			case FRACTION:
				if (isIntegral(left) && isIntegral(expr.get(1))) {
					return primitive(TypeKind.FRACTION);
				}
				return Type.unknown();
			case UNARY_MINUS:
				if (isIntegral(left)) {
					return primitive(TypeKind.INT);
				} else if (isNumber(left)) {
					return primitive(TypeKind.DOUBLE);
				}
				return Type.unknown();
			case RATE:
				if (isCost(left) || isClock(left)) {
					return primitive(TypeKind.RATE);
				}
				return Type.unknown();
			default:
				return Type.unknown();
		}
	}

	private Type logicalType(Expression expr) {
		Expression left = expr.get(0);
		if (expr.getKind() == ExpressionKind.NOT) {
			if (isIntegral(left)) {
				return primitive(TypeKind.BOOL);
			} else if (isConstraint(left)) {
				return primitive(TypeKind.CONSTRAINT);
			}
			return Type.unknown();
		}
		Expression right = expr.get(1);
		if (isIntegral(left) && isIntegral(right)) {
			return primitive(TypeKind.BOOL);
		}
		switch (expr.getKind()) {
			case AND:
				if (isInvariant(left) && isInvariant(right)) {
					return primitive(TypeKind.INVARIANT);
				} else if (isInvariantWR(left) && isInvariantWR(right)) {
					return primitive(TypeKind.INVARIANT_WR);
				} else if (isGuard(left) && isGuard(right)) {
					return primitive(TypeKind.GUARD);
				} else if (isConstraint(left) && isConstraint(right)) {
					return primitive(TypeKind.CONSTRAINT);
				} else if (isFormula(left) && isFormula(right)) {
					return primitive(TypeKind.FORMULA);
				}
				return Type.unknown();
			case OR:
				if ((isIntegral(left) && isInvariant(right)) || (isInvariant(left) && isIntegral(right))) {
					return primitive(TypeKind.INVARIANT);
				} else if ((isIntegral(left) && isInvariantWR(right)) || (isInvariantWR(left) && isIntegral(right))) {
					return primitive(TypeKind.INVARIANT_WR);
				} else if ((isIntegral(left) && isGuard(right)) || (isGuard(left) && isIntegral(right))) {
					return primitive(TypeKind.GUARD);
				} else if (isConstraint(left) && isConstraint(right)) {
					return primitive(TypeKind.CONSTRAINT);
				}
				return Type.unknown();
			default:
				// XOR is only defined on integral operands
				return Type.unknown();
		}
	}

	private static boolean isClockComparison(Expression left, Expression right) {
		return (isClock(left) && isClock(right)) ||
				(isClock(left) && isInteger(right)) ||
				(isInteger(left) && isClock(right)) ||
				(isDiff(left) && isInteger(right)) ||
				(isInteger(left) && isDiff(right));
	}

	private Type comparisonType(Expression expr) {
		Expression left = expr.get(0);
		Expression right = expr.get(1);
		switch (expr.getKind()) {
			case EQ:
				if (isClockComparison(left, right)) {
					return primitive(TypeKind.GUARD);
				} else if (areEqCompatible(left.getType(), right.getType())) {
					return primitive(TypeKind.BOOL);
				} else if ((left.getType().is(TypeKind.RATE) && (isIntegral(right) || isDoubleValue(right))) ||
						((isIntegral(left) || isDoubleValue(left)) && right.getType().is(TypeKind.RATE))) {
					return primitive(TypeKind.INVARIANT_WR);
				} else if (isNumber(left) && isNumber(right)) {
					return primitive(TypeKind.BOOL);
				}
				return Type.unknown();
			case NEQ:
				if (areEqCompatible(left.getType(), right.getType())) {
					return primitive(TypeKind.BOOL);
				} else if (isClockComparison(left, right)) {
					return primitive(TypeKind.CONSTRAINT);
				} else if (isNumber(left) && isNumber(right)) {
					return primitive(TypeKind.BOOL);
				}
				return Type.unknown();
			default:
				if (isIntegral(left) && isIntegral(right)) {
					return primitive(TypeKind.BOOL);
				} else if ((isClock(left) && isClock(right)) ||
						(isClock(left) && isBound(right)) ||
						(isClock(right) && isBound(left)) ||
						(isDiff(left) && isBound(right)) ||
						(isDiff(right) && isBound(left))) {
					return primitive(TypeKind.INVARIANT);
				} else if ((isClock(left) && isInteger(right)) || (isInteger(left) && isClock(right))) {
					return primitive(TypeKind.GUARD);
				} else if (isNumber(left) && isNumber(right)) {
					return primitive(TypeKind.BOOL);
				}
				return Type.unknown();
		}
	}

	private Type assignmentType(Expression expr) {
		Expression left = expr.get(0);
		switch (expr.getKind()) {
			case ASSIGN:
				if (!areAssignmentCompatible(left.getType(), expr.get(1).getType())) {
					error(TypeCheckingIssue.Reason.INCOMPATIBLE_TYPES, expr,
							left.getType() + " = " + expr.get(1).getType());
					return null;
				}
				if (!isModifiableLValue(left)) {
					error(TypeCheckingIssue.Reason.LEFT_HAND_SIDE_EXPECTED, left);
					return null;
				}
				return left.getType();
			case ASSPLUS:
				if ((!isInteger(left) && !isCost(left)) || !isIntegral(expr.get(1))) {
					error(TypeCheckingIssue.Reason.INCREMENT_OPERATOR_MISUSE, expr);
					return null;
				}
				if (!isModifiableLValue(left)) {
					error(TypeCheckingIssue.Reason.LEFT_HAND_SIDE_EXPECTED, left);
					return null;
				}
				return left.getType();
			case PREINCREMENT:
			case POSTINCREMENT:
			case PREDECREMENT:
			case POSTDECREMENT:
				if (!isModifiableLValue(left)) {
					error(TypeCheckingIssue.Reason.LEFT_HAND_SIDE_EXPECTED, left);
					return null;
				}
				if (!isInteger(left)) {
					error(TypeCheckingIssue.Reason.INTEGER_EXPECTED, expr);
					return null;
				}
				return primitive(TypeKind.INT);
			default:
				if (!isIntegral(left) || !isIntegral(expr.get(1))) {
					error(TypeCheckingIssue.Reason.NON_INTEGER_COMPOUND_ASSIGNMENT, expr);
					return null;
				}
				if (!isModifiableLValue(left)) {
					error(TypeCheckingIssue.Reason.LEFT_HAND_SIDE_EXPECTED, left);
					return null;
				}
				return left.getType();
		}
	}

	private Type mathFunctionType(Expression expr) {
		MathFunctions.Signature signature = MathFunctions.signatureOf(expr.getKind());
		if (expr.getSize() != signature.getArity()) {
			error(TypeCheckingIssue.Reason.WRONG_NUMBER_OF_ARGUMENTS, expr);
			return null;
		}
		// the last argument is checked first
		for (int i = expr.getSize() - 1; i >= 0; --i) {
			Expression argument = expr.get(i);
			if (signature.isIntegerArgument(i)) {
				if (!isIntegral(argument)) {
					error(TypeCheckingIssue.Reason.INTEGER_EXPECTED, argument);
					return null;
				}
			} else if (!isNumber(argument)) {
				error(TypeCheckingIssue.Reason.NUMBER_EXPECTED, argument);
				return null;
			}
		}
		return primitive(signature.getResult());
	}

	private Type inlineIfType(Expression expr) {
		if (!isIntegral(expr.get(0))) {
			error(TypeCheckingIssue.Reason.INLINE_IF_CONDITION_NOT_INTEGER, expr);
			return null;
		}
		if (!areInlineIfCompatible(expr.get(1).getType(), expr.get(2).getType())) {
			error(TypeCheckingIssue.Reason.INCOMPATIBLE_INLINE_IF_ARGUMENTS, expr,
					expr.get(1).getType() + " : " + expr.get(2).getType());
			return null;
		}
		return expr.get(1).getType();
	}

	private Type commaType(Expression expr) {
		for (Expression operand : expr.getChildren()) {
			if (!isAssignable(operand.getType()) && !isVoid(operand)) {
				error(TypeCheckingIssue.Reason.INCOMPATIBLE_COMMA_TYPE, operand, operand.getType().toString());
				return null;
			}
		}
		// warn on the first check only
		if (expr.getType().isUnknown()) {
			checkIgnoredValue(expr.get(0));
		}
		return expr.get(1).getType();
	}

	private Type indexType(Expression expr) {
		Type array = expr.get(0).getType();
		Type index = expr.get(1).getType();
		if (!array.isArray()) {
			error(TypeCheckingIssue.Reason.ARRAY_EXPECTED, expr.get(0), array.toString());
			return null;
		}
		Type size = array.getArraySize();
		if (size.isInteger() && index.isIntegral()) {
			return array.getSub();
		} else if (size.isScalar() && index.isScalar() && isSameScalarType(size, index)) {
			return array.getSub();
		}
		error(TypeCheckingIssue.Reason.INCOMPATIBLE_INDEX, expr.get(1), index.toString());
		return null;
	}

	private Type quantifierType(Expression expr) {
		Expression body = expr.get(expr.getSize() - 1);
		checkType(expr.get(0).getSymbol().getType());

		Type type;
		switch (expr.getKind()) {
			case FORALL:
				if (isIntegral(body)) {
					type = primitive(TypeKind.BOOL);
				} else if (isInvariant(body)) {
					type = primitive(TypeKind.INVARIANT);
				} else if (isInvariantWR(body)) {
					type = primitive(TypeKind.INVARIANT_WR);
				} else if (isGuard(body)) {
					type = primitive(TypeKind.GUARD);
				} else if (isConstraint(body)) {
					type = primitive(TypeKind.CONSTRAINT);
				} else {
					error(TypeCheckingIssue.Reason.BOOLEAN_EXPECTED, body);
					type = null;
				}
				break;
			case EXISTS:
				if (isIntegral(body)) {
					type = primitive(TypeKind.BOOL);
				} else if (isConstraint(body)) {
					type = primitive(TypeKind.CONSTRAINT);
				} else {
					error(TypeCheckingIssue.Reason.BOOLEAN_EXPECTED, body);
					type = null;
				}
				break;
			case SUM:
				if (isIntegral(body)) {
					type = primitive(TypeKind.INT);
				} else if (isNumber(body)) {
					type = primitive(TypeKind.DOUBLE);
				} else {
					error(TypeCheckingIssue.Reason.NUMBER_EXPECTED, body);
					type = null;
				}
				break;
			default:
				// the sum over the instances of a dynamic template
				if (isIntegral(body) || isDoubleValue(body)) {
					type = body.getType();
				} else if (isInvariant(body) || isGuard(body)) {
					type = primitive(TypeKind.DOUBLEINVGUARD);
				} else {
					error(TypeCheckingIssue.Reason.INVALID_SUM, expr);
					type = null;
				}
		}

		// reported even when the body has the wrong type
		if (body.changesAnyVariable()) {
			error(TypeCheckingIssue.Reason.EXPRESSION_MUST_BE_SIDE_EFFECT_FREE, body);
			return null;
		}
		return type;
	}

	private Type dynamicType(Expression expr) {
		switch (expr.getKind()) {
			case SPAWN: {
				Template dynamic = system.getDynamicTemplate(expr.get(0).getSymbol().getName());
				if (dynamic == null) {
					error(TypeCheckingIssue.Reason.SPAWN_NON_DYNAMIC, expr);
					return null;
				}
				Frame parameters = dynamic.getParameters();
				if (parameters.getSize() != expr.getSize() - 1) {
					error(TypeCheckingIssue.Reason.WRONG_NUMBER_OF_ARGUMENTS, expr);
					return null;
				}
				for (int i = 0; i < parameters.getSize(); ++i) {
					if (!checkParameterCompatible(parameters.get(i).getType(), expr.get(i + 1))) {
						return null;
					}
				}
				if (!dynamic.isDefined()) {
					error(TypeCheckingIssue.Reason.TEMPLATE_NOT_DEFINED, expr, dynamic.getName());
					return null;
				}
				return primitive(TypeKind.INT);
			}
			case NUMOF:
				if (system.getDynamicTemplate(expr.get(0).getSymbol().getName()) == null) {
					error(TypeCheckingIssue.Reason.NOT_A_DYNAMIC_TEMPLATE, expr);
					return null;
				}
				return primitive(TypeKind.INT);
			default:
				if (template == null) {
					error(TypeCheckingIssue.Reason.EXIT_OUTSIDE_TEMPLATE, expr);
					return null;
				}
				if (!template.isDynamic()) {
					error(TypeCheckingIssue.Reason.EXIT_IN_NON_DYNAMIC_TEMPLATE, expr, template.getName());
					return null;
				}
				return primitive(TypeKind.INT);
		}
	}

	private boolean isProcessExpression(Expression e) {
		return e.getType().is(TypeKind.TIOGRAPH) || isProcessID(e);
	}

	private boolean isGraphOrIdentifier(Expression e) {
		return e.getType().is(TypeKind.TIOGRAPH) || e.getKind() == ExpressionKind.IDENTIFIER;
	}

	/**
	 * Path formulas, controller synthesis, refinement and statistical queries.
	 */
	private Type propertyType(Expression expr) {
		boolean ok = true;
		switch (expr.getKind()) {
			case AF:
			case AG:
			case EF:
			case EG:
			case EF_R:
			case AG_R:
			case EF_CONTROL:
			case CONTROL:
			case CONTROL_TOPT:
			case CONTROL_TOPT_DEF1:
			case CONTROL_TOPT_DEF2:
			case PMAX:
				if (isFormula(expr.get(0))) {
					return primitive(TypeKind.FORMULA);
				}
				return Type.unknown();
			case PO_CONTROL:
				if (isListOfFormulas(expr.get(0)) && isFormula(expr.get(1))) {
					return primitive(TypeKind.FORMULA);
				}
				return Type.unknown();
			case LEADSTO:
			case SCENARIO2:
			case A_UNTIL:
			case A_WEAKUNTIL:
			case A_BUCHI:
				if (isFormula(expr.get(0)) && isFormula(expr.get(1))) {
					return primitive(TypeKind.FORMULA);
				}
				return Type.unknown();
			case SCENARIO:
			case MITLFORMULA:
			case MITLCONJ:
			case MITLDISJ:
			case MITLNEXT:
			case MITLUNTIL:
			case MITLRELEASE:
			case MITLATOM:
			case MITLFORALL:
			case MITLEXISTS:
				return primitive(TypeKind.FORMULA);
			case RESTRICT:
				if (!isIDList(expr.get(0), TypeKind.PROCESS)) {
					error(TypeCheckingIssue.Reason.COMPOSITION_OF_PROCESSES_EXPECTED, expr.get(0));
					ok = false;
				}
				if (!isIDList(expr.get(1), TypeKind.CHANNEL)) {
					error(TypeCheckingIssue.Reason.LIST_OF_CHANNELS_EXPECTED, expr.get(1));
					ok = false;
				}
				return ok ? primitive(TypeKind.FORMULA) : null;
			case SIMULATION_LE:
			case SIMULATION_GE: {
				boolean le = expr.getKind() == ExpressionKind.SIMULATION_LE;
				Expression restricted = le ? expr.get(0) : expr.get(1);
				Expression composition = le ? expr.get(1) : expr.get(0);
				if (restricted.getKind() != ExpressionKind.RESTRICT) {
					error(TypeCheckingIssue.Reason.COMPOSITION_OF_PROCESSES_EXPECTED, restricted);
					ok = false;
				}
				if (!isIDList(composition, TypeKind.PROCESS)) {
					error(TypeCheckingIssue.Reason.COMPOSITION_OF_PROCESSES_EXPECTED, composition);
					ok = false;
				}
				return ok ? primitive(TypeKind.FORMULA) : null;
			}
			case TIOQUOTIENT:
				for (Expression operand : expr.getChildren()) {
					if (!isProcessExpression(operand)) {
						error(TypeCheckingIssue.Reason.PROCESS_EXPRESSION_EXPECTED, operand);
						ok = false;
					}
				}
				return ok ? primitive(TypeKind.TIOGRAPH) : null;
			case CONSISTENCY:
				if (!isProcessExpression(expr.get(0))) {
					error(TypeCheckingIssue.Reason.PROCESS_EXPRESSION_EXPECTED, expr.get(0));
					ok = false;
				}
				if (!isFormula(expr.get(1))) {
					error(TypeCheckingIssue.Reason.PROPERTY_MUST_BE_VALID_FORMULA, expr.get(1));
					ok = false;
				}
				return ok ? primitive(TypeKind.TIOGRAPH) : null;
			case SPECIFICATION:
			case IMPLEMENTATION:
				if (!isProcessExpression(expr.get(0))) {
					error(TypeCheckingIssue.Reason.PROCESS_EXPRESSION_EXPECTED, expr.get(0));
					return null;
				}
				return primitive(TypeKind.FORMULA);
			case TIOCOMPOSITION:
			case TIOCONJUNCTION:
			case SYNTAX_COMPOSITION:
				for (Expression operand : expr.getChildren()) {
					if (!isGraphOrIdentifier(operand)) {
						error(TypeCheckingIssue.Reason.PROCESS_EXPRESSION_EXPECTED, operand);
						ok = false;
					}
				}
				return ok ? primitive(TypeKind.TIOGRAPH) : null;
			case REFINEMENT_LE:
			case REFINEMENT_GE:
				for (Expression operand : expr.getChildren()) {
					if (!isGraphOrIdentifier(operand)) {
						error(TypeCheckingIssue.Reason.PROCESS_EXPRESSION_EXPECTED, operand);
						ok = false;
					}
				}
				return ok ? primitive(TypeKind.FORMULA) : null;
			case SUP_VAR:
			case INF_VAR:
				return supInfType(expr);
			case SIMULATE:
			case SIMULATEREACH:
				return simulateType(expr);
			case SMC_CONTROL:
				if (expr.getSize() != 3) {
					bug(InternalConsistencyIssue.Reason.WRONG_NUMBER_OF_ARGUMENTS, expr);
					return null;
				}
				ok &= checkBoundTypeOrBoundedExpr(expr.get(0));
				ok &= checkTimeBound(expr.get(1));
				if (!ok) {
					return null;
				}
				if (isFormula(expr.get(2))) {
					return primitive(TypeKind.FORMULA);
				}
				return Type.unknown();
			case PROBAMINBOX:
			case PROBAMINDIAMOND:
				if (expr.getSize() != 5) {
					bug(InternalConsistencyIssue.Reason.WRONG_NUMBER_OF_ARGUMENTS, expr);
					return null;
				}
				ok = checkNrOfRuns(expr.get(0));
				if (ok && expr.get(0).getValue() > 0) {
					error(TypeCheckingIssue.Reason.EXPLICIT_RUN_COUNT_UNSUPPORTED, expr.get(0));
					ok = false;
				}
				ok &= checkBoundTypeOrBoundedExpr(expr.get(1));
				ok &= checkTimeBound(expr.get(2));
				ok &= checkPredicate(expr.get(3));
				ok &= checkProbBound(expr.get(4));
				return ok ? primitive(TypeKind.FORMULA) : null;
			case PROBABOX:
			case PROBADIAMOND:
				if (expr.getSize() != 5) {
					bug(InternalConsistencyIssue.Reason.WRONG_NUMBER_OF_ARGUMENTS, expr);
					return null;
				}
				ok &= checkNrOfRuns(expr.get(0));
				ok &= checkBoundTypeOrBoundedExpr(expr.get(1));
				ok &= checkTimeBound(expr.get(2));
				ok &= checkPredicate(expr.get(3));
				ok &= checkUntilCond(expr.getKind(), expr.get(4));
				return ok ? primitive(TypeKind.FORMULA) : null;
			case PROBACMP:
				if (expr.getSize() != 8) {
					bug(InternalConsistencyIssue.Reason.WRONG_NUMBER_OF_ARGUMENTS, expr);
					return null;
				}
				for (int first = 0; first < 8; first += 4) {
					ok &= checkBoundTypeOrBoundedExpr(expr.get(first));
					ok &= checkTimeBound(expr.get(first + 1));
					ok &= checkPathQuant(expr.get(first + 2));
					ok &= checkPredicate(expr.get(first + 3));
				}
				return ok ? primitive(TypeKind.FORMULA) : null;
			case PROBAEXP:
				if (expr.getSize() != 5) {
					bug(InternalConsistencyIssue.Reason.WRONG_NUMBER_OF_ARGUMENTS, expr);
					return null;
				}
				ok &= checkNrOfRuns(expr.get(0));
				ok &= checkBoundTypeOrBoundedExpr(expr.get(1));
				ok &= checkTimeBound(expr.get(2));
				ok &= checkAggregationOp(expr.get(3));
				ok &= checkMonitoredExpr(expr.get(4));
				return ok ? primitive(TypeKind.FORMULA) : null;
			default:
				return Type.unknown();
		}
	}

	private Type supInfType(Expression expr) {
		Expression predicate = expr.get(0);
		if (!isIntegral(predicate) && !isConstraint(predicate)) {
			error(TypeCheckingIssue.Reason.BOOLEAN_EXPECTED, predicate);
			return null;
		}
		Expression observed = expr.get(1);
		if (observed.getKind() != ExpressionKind.LIST) {
			return Type.unknown();
		}
		for (Expression e : observed.getChildren()) {
			if (isIntegral(e)) {
				if (e.changesAnyVariable()) {
					error(TypeCheckingIssue.Reason.EXPRESSION_MUST_BE_SIDE_EFFECT_FREE, e);
					return null;
				}
			} else if (!isClock(e)) {
				error(TypeCheckingIssue.Reason.TYPE_ERROR, e, e.getType().toString());
				return null;
			}
		}
		return primitive(TypeKind.FORMULA);
	}

	/**
	 * simulate [runs] [bound type <= bound] { monitored... } and its reachability variant,
	 * which ends in a predicate and a number of accepting runs.
	 */
	private Type simulateType(Expression expr) {
		boolean ok = checkNrOfRuns(expr.get(0));
		if (ok && expr.get(0).getValue() <= 0) {
			error(TypeCheckingIssue.Reason.INVALID_RUN_COUNT, expr.get(0));
			ok = false;
		}
		ok &= checkBoundTypeOrBoundedExpr(expr.get(1));
		ok &= checkTimeBound(expr.get(2));
		if (!ok) {
			return null;
		}
		int monitoredEnd = expr.getSize();
		if (expr.getKind() == ExpressionKind.SIMULATEREACH) {
			monitoredEnd -= 2;
			boolean reachOk = checkPredicate(expr.get(monitoredEnd));
			reachOk &= checkNrOfRuns(expr.get(monitoredEnd + 1));
			if (!reachOk) {
				return null;
			}
		}
		for (int i = 3; i < monitoredEnd; ++i) {
			if (!checkMonitoredExpr(expr.get(i))) {
				return null;
			}
		}
		return primitive(TypeKind.FORMULA);
	}

	private boolean checkNrOfRuns(Expression runs) {
		if (!isCompileTimeComputable(runs)) {
			error(TypeCheckingIssue.Reason.MUST_BE_COMPUTABLE_AT_COMPILE_TIME, runs);
			return false;
		}
		if (!isConstantInteger(runs)) {
			error(TypeCheckingIssue.Reason.INTEGER_EXPECTED, runs);
			return false;
		}
		return true;
	}

	private boolean checkBoundTypeOrBoundedExpr(Expression boundTypeOrExpr) {
		if (!isConstantInteger(boundTypeOrExpr) && !isClock(boundTypeOrExpr)) {
			error(TypeCheckingIssue.Reason.CLOCK_EXPECTED, boundTypeOrExpr);
			return false;
		}
		return true;
	}

	private boolean checkTimeBound(Expression bound) {
		if (!isCompileTimeComputable(bound)) {
			error(TypeCheckingIssue.Reason.MUST_BE_COMPUTABLE_AT_COMPILE_TIME, bound);
			return false;
		}
		if (!isIntegral(bound)) {
			error(TypeCheckingIssue.Reason.INTEGER_EXPECTED, bound);
			return false;
		}
		return true;
	}

	private boolean checkPredicate(Expression predicate) {
		if (!isIntegral(predicate) && !isConstraint(predicate)) {
			error(TypeCheckingIssue.Reason.BOOLEAN_EXPECTED, predicate);
			return false;
		}
		if (predicate.changesAnyVariable()) {
			error(TypeCheckingIssue.Reason.PROPERTY_MUST_BE_SIDE_EFFECT_FREE, predicate);
			return false;
		}
		return true;
	}

	private boolean checkProbBound(Expression probBound) {
		if (!isConstantDouble(probBound)) {
			error(TypeCheckingIssue.Reason.PROBABILITY_BOUND_EXPECTED, probBound);
			return false;
		}
		return true;
	}

	private boolean checkUntilCond(ExpressionKind kind, Expression untilCond) {
		boolean ok = true;
		if (kind == ExpressionKind.PROBADIAMOND && !isIntegral(untilCond) && !isConstraint(untilCond)) {
			error(TypeCheckingIssue.Reason.BOOLEAN_EXPECTED, untilCond);
			ok = false;
		}
		// Pr[] only supports the trivial until condition false
		if (kind == ExpressionKind.PROBABOX && untilCond.getKind() == ExpressionKind.CONSTANT &&
				untilCond.getType().isBoolean() && untilCond.getValue() != 0) {
			error(TypeCheckingIssue.Reason.MUST_BE_FALSE, untilCond);
			ok = false;
		}
		return ok;
	}

	private boolean checkMonitoredExpr(Expression expr) {
		if (!isIntegral(expr) && !isClock(expr) && !isDoubleValue(expr) &&
				!expr.getType().is(TypeKind.DOUBLEINVGUARD) && !isConstraint(expr)) {
			error(TypeCheckingIssue.Reason.INTEGER_OR_CLOCK_EXPECTED, expr);
			return false;
		}
		if (expr.changesAnyVariable()) {
			error(TypeCheckingIssue.Reason.PROPERTY_MUST_BE_SIDE_EFFECT_FREE, expr);
			return false;
		}
		return true;
	}

	private boolean checkPathQuant(Expression expr) {
		if (!isConstantInteger(expr)) {
			bug(InternalConsistencyIssue.Reason.BAD_PATH_QUANTIFIER, expr);
			return false;
		}
		return true;
	}

	// 0 is min, 1 is max
	private boolean checkAggregationOp(Expression expr) {
		if (!isConstantInteger(expr)) {
			bug(InternalConsistencyIssue.Reason.BAD_AGGREGATION_OPERATOR, expr);
			return false;
		}
		if (expr.getValue() > 1) {
			bug(InternalConsistencyIssue.Reason.BAD_AGGREGATION_OPERATOR_VALUE, expr);
			return false;
		}
		return true;
	}

	/**
	 * Warns about expressions whose value is ignored and that have no side effect. Changes to
	 * local variables count as side effects here. For comma expressions only the right operand
	 * is examined, the left one has been examined when the comma was checked.
	 */
	void checkIgnoredValue(Expression expr) {
		ExpressionKind kind = expr.getKind();
		if (kind != ExpressionKind.EXIT && kind != ExpressionKind.SPAWN && !expr.changesAnyVariable()) {
			warning(TypeCheckingWarning.Reason.EXPRESSION_HAS_NO_EFFECT, expr);
		} else if (kind == ExpressionKind.COMMA) {
			checkIgnoredValue(expr.get(1));
		}
	}

	/**
	 * Checks an expression whose value is discarded: expression statements, the init and step
	 * of for loops, edge updates and chart updates. Its type must be assignable or void. Apart
	 * from the constant 1, which stands for an empty update, it should have an effect.
	 */
	public boolean checkAssignmentExpression(Expression expr) {
		if (expr == null) {
			return true;
		}
		if (!checkExpression(expr)) {
			return false;
		}
		if (!isAssignable(expr.getType()) && !isVoid(expr)) {
			error(TypeCheckingIssue.Reason.INVALID_ASSIGNMENT_EXPRESSION, expr, expr.getType().toString());
			return false;
		}
		if (expr.getKind() != ExpressionKind.CONSTANT || expr.getValue() != 1) {
			checkIgnoredValue(expr);
		}
		return true;
	}

	/**
	 * Checks a condition of an if, while, do-while or for statement.
	 */
	public boolean checkConditionalExpressionInFunction(Expression expr) {
		if (!isIntegral(expr)) {
			error(TypeCheckingIssue.Reason.BOOLEAN_EXPECTED, expr, expr.getType().toString());
			return false;
		}
		return true;
	}

	/**
	 * Checks that init can initialise a variable of the given type. List initialisers of
	 * records are reordered to follow the order of the record's fields.
	 *
	 * @return the initialiser to use from now on: init itself, or the reordered initialiser
	 */
	public Expression checkInitialiser(Type type, Expression init) {
		if (areAssignmentCompatible(type, init.getType(), true)) {
			return init;
		}
		if (type.isArray() && init.getKind() == ExpressionKind.LIST) {
			Type subtype = type.getSub();
			List<Expression> result = new ArrayList<>(init.getSize());
			for (int i = 0; i < init.getSize(); ++i) {
				if (!init.getType().getLabel(i).isEmpty()) {
					error(TypeCheckingIssue.Reason.FIELD_NAME_IN_ARRAY_INITIALISER, init.get(i),
							init.getType().getLabel(i));
				}
				result.add(checkInitialiser(subtype, init.get(i)));
			}
			return Expression.createNary(ExpressionKind.LIST, result, init.getLocation(), type);
		}
		if (type.isRecord() && init.getKind() == ExpressionKind.LIST) {
			int size = type.getRecordSize();
			Expression[] result = new Expression[size];
			int current = 0;
			for (int i = 0; i < init.getSize(); ++i, ++current) {
				String label = init.getType().getLabel(i);
				if (!label.isEmpty()) {
					current = type.findIndexOf(label);
					if (current == -1) {
						error(TypeCheckingIssue.Reason.UNKNOWN_FIELD, init.get(i), label);
						break;
					}
				}
				if (current >= size) {
					error(TypeCheckingIssue.Reason.TOO_MANY_ELEMENTS, init.get(i));
					break;
				}
				if (result[current] != null) {
					error(TypeCheckingIssue.Reason.MULTIPLE_INITIALISERS, init.get(i), type.getRecordLabel(current));
					continue;
				}
				result[current] = checkInitialiser(type.getSub(current), init.get(i));
			}
			List<Expression> filled = new ArrayList<>(size);
			for (int i = 0; i < size; ++i) {
				if (result[i] == null) {
					error(TypeCheckingIssue.Reason.INCOMPLETE_INITIALISER, init, type.getRecordLabel(i));
					break;
				}
				filled.add(result[i]);
			}
			// a list cannot have holes, so an incomplete initialiser is kept as written
			if (filled.size() < size) {
				return init;
			}
			return Expression.createNary(ExpressionKind.LIST, filled, init.getLocation(), type);
		}
		error(TypeCheckingIssue.Reason.INVALID_INITIALISER, init, type.toString());
		return init;
	}

	/**
	 * Whether an argument may be passed for a parameter of the given type. Non-constant
	 * reference parameters need a modifiable lvalue. Channels are compared by capability.
	 */
	public boolean isParameterCompatible(Type parameter, Expression argument) {
		boolean ref = parameter.is(TypeKind.REF);
		boolean constant = parameter.isConstant();
		boolean lvalue = isModifiableLValue(argument);
		Type argumentType = argument.getType();
		if (ref && !constant && !lvalue) {
			return false;
		}
		if (parameter.isChannel() && argumentType.isChannel()) {
			return channelCapability(argumentType) >= channelCapability(parameter);
		} else if (ref && lvalue) {
			return areEquivalent(argumentType, parameter);
		}
		return areAssignmentCompatible(parameter, argumentType);
	}

	public boolean checkParameterCompatible(Type parameter, Expression argument) {
		if (!isParameterCompatible(parameter, argument)) {
			error(TypeCheckingIssue.Reason.INCOMPATIBLE_ARGUMENT, argument,
					argument.getType() + " for " + parameter);
			return false;
		}
		return true;
	}

	public boolean isLValue(Expression expr) {
		switch (expr.getKind()) {
			case IDENTIFIER:
			case PREINCREMENT:
			case PREDECREMENT:
				return true;
			case DOT:
			case ARRAY:
				return isLValue(expr.get(0));
			case INLINEIF:
				return isLValue(expr.get(1)) && isLValue(expr.get(2)) &&
						areEquivalent(expr.get(1).getType(), expr.get(2).getType());
			case COMMA:
				return isLValue(expr.get(1));
			default:
				// functions cannot return references
				return expr.getKind().isAssignment();
		}
	}

	public boolean isModifiableLValue(Expression expr) {
		switch (expr.getKind()) {
			case IDENTIFIER:
				return expr.getType().isNonConstant();
			case DOT:
				// processes only occur in properties, which are side-effect free anyway
				if (expr.get(0).getType().isProcess()) {
					return false;
				}
				return isModifiableLValue(expr.get(0));
			case ARRAY:
				return isModifiableLValue(expr.get(0));
			case PREINCREMENT:
			case PREDECREMENT:
				return true;
			case INLINEIF:
				return isModifiableLValue(expr.get(1)) && isModifiableLValue(expr.get(2)) &&
						areEquivalent(expr.get(1).getType(), expr.get(2).getType());
			case COMMA:
				return isModifiableLValue(expr.get(1));
			default:
				return expr.getKind().isAssignment();
		}
	}

	/**
	 * Like {@link #isLValue(Expression)}, but the reference must not depend on anything that
	 * is not computable at compile time: a[v] is an lvalue, but for a non-constant v it is not
	 * a unique reference.
	 */
	public boolean isUniqueReference(Expression expr) {
		switch (expr.getKind()) {
			case IDENTIFIER:
				return true;
			case DOT:
				return isUniqueReference(expr.get(0));
			case ARRAY:
				return isUniqueReference(expr.get(0)) && isCompileTimeComputable(expr.get(1));
			case PREINCREMENT:
			case PREDECREMENT:
				return isUniqueReference(expr.get(0));
			case INLINEIF:
				return false;
			case COMMA:
				return isUniqueReference(expr.get(1));
			default:
				return expr.getKind().isAssignment() && isUniqueReference(expr.get(0));
		}
	}

}
