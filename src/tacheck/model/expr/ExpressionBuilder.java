package tacheck.model.expr;

import tacheck.model.type.Type;
import tacheck.model.type.TypeKind;
import tacheck.scope.Symbol;
import tacheck.util.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Shorthands for building expressions the way a parser front end would: leaves and the
 * declaration-derived nodes (identifiers, constants, lists, field accesses, calls, synchronisations)
 * get their type here, everything else starts out with an unknown type for the type checker to
 * infer.
 */
public class ExpressionBuilder {
	private ExpressionBuilder() {}

	private static SourceLocation loc() {
		return SourceLocation.unknown();
	}

	public static Expression num(int value) {
		return Expression.createConstant(value, Type.primitive(TypeKind.INT), loc());
	}

	public static Expression bool(boolean value) {
		return Expression.createConstant(value ? 1 : 0, Type.primitive(TypeKind.BOOL), loc());
	}

	public static Expression real(double value) {
		return Expression.createDouble(value, Type.primitive(TypeKind.DOUBLE), loc());
	}

	public static Expression id(Symbol symbol) {
		return Expression.createIdentifier(symbol, loc());
	}

	public static Expression unary(ExpressionKind kind, Expression operand) {
		return Expression.createUnary(kind, operand, loc(), Type.unknown());
	}

	public static Expression binary(ExpressionKind kind, Expression left, Expression right) {
		return Expression.createBinary(kind, left, right, loc(), Type.unknown());
	}

	public static Expression nary(ExpressionKind kind, Expression... children) {
		return Expression.createNary(kind, Arrays.asList(children), loc(), Type.unknown());
	}

	public static Expression plus(Expression left, Expression right) {
		return binary(ExpressionKind.PLUS, left, right);
	}

	public static Expression minus(Expression left, Expression right) {
		return binary(ExpressionKind.MINUS, left, right);
	}

	public static Expression mult(Expression left, Expression right) {
		return binary(ExpressionKind.MULT, left, right);
	}

	public static Expression and(Expression left, Expression right) {
		return binary(ExpressionKind.AND, left, right);
	}

	public static Expression or(Expression left, Expression right) {
		return binary(ExpressionKind.OR, left, right);
	}

	public static Expression not(Expression operand) {
		return unary(ExpressionKind.NOT, operand);
	}

	public static Expression lt(Expression left, Expression right) {
		return binary(ExpressionKind.LT, left, right);
	}

	public static Expression le(Expression left, Expression right) {
		return binary(ExpressionKind.LE, left, right);
	}

	public static Expression gt(Expression left, Expression right) {
		return binary(ExpressionKind.GT, left, right);
	}

	public static Expression ge(Expression left, Expression right) {
		return binary(ExpressionKind.GE, left, right);
	}

	public static Expression eq(Expression left, Expression right) {
		return binary(ExpressionKind.EQ, left, right);
	}

	public static Expression neq(Expression left, Expression right) {
		return binary(ExpressionKind.NEQ, left, right);
	}

	public static Expression assign(Expression left, Expression right) {
		return binary(ExpressionKind.ASSIGN, left, right);
	}

	public static Expression increment(Expression operand) {
		return unary(ExpressionKind.POSTINCREMENT, operand);
	}

	public static Expression comma(Expression left, Expression right) {
		return binary(ExpressionKind.COMMA, left, right);
	}

	public static Expression inlineIf(Expression condition, Expression yes, Expression no) {
		return Expression.createTernary(ExpressionKind.INLINEIF, condition, yes, no, loc(), Type.unknown());
	}

	public static Expression index(Expression array, Expression index) {
		return binary(ExpressionKind.ARRAY, array, index);
	}

	/**
	 * The derivative of a clock or cost variable, as in cost' == 2.
	 */
	public static Expression rate(Expression operand) {
		return unary(ExpressionKind.RATE, operand);
	}

	public static Expression dot(Expression record, String field) {
		Type type = record.getType();
		int index = type.findIndexOf(field);
		if (index == -1) {
			throw new IllegalArgumentException("no field " + field + " in " + type);
		}
		return Expression.createDot(record, index, loc(), type.getSub(index));
	}

	/**
	 * An unlabelled list literal such as {1, 2, 3}.
	 */
	public static Expression list(Expression... values) {
		return list(Collections.nCopies(values.length, ""), Arrays.asList(values));
	}

	/**
	 * A list literal whose entries may be labelled with field names; unlabelled entries use "".
	 */
	public static Expression list(List<String> labels, List<Expression> values) {
		List<Type> types = new ArrayList<>(values.size());
		for (Expression value : values) {
			types.add(value.getType());
		}
		return Expression.createNary(ExpressionKind.LIST, values, loc(), Type.record(types, labels));
	}

	public static Expression call(Symbol function, Expression... arguments) {
		List<Expression> children = new ArrayList<>(arguments.length + 1);
		children.add(id(function));
		children.addAll(Arrays.asList(arguments));
		return Expression.createNary(ExpressionKind.FUNCALL, children, loc(), function.getType().get(0));
	}

	private static Expression quantifier(ExpressionKind kind, Symbol binder, Expression body) {
		return binary(kind, id(binder), body);
	}

	public static Expression forall(Symbol binder, Expression body) {
		return quantifier(ExpressionKind.FORALL, binder, body);
	}

	public static Expression exists(Symbol binder, Expression body) {
		return quantifier(ExpressionKind.EXISTS, binder, body);
	}

	public static Expression sum(Symbol binder, Expression body) {
		return quantifier(ExpressionKind.SUM, binder, body);
	}

	/**
	 * The sum over all running instances of a dynamic template.
	 */
	public static Expression sumDynamic(Symbol binder, Symbol template, Expression body) {
		return Expression.createTernary(ExpressionKind.SUMDYNAMIC, id(binder), id(template), body, loc(),
				Type.unknown());
	}

	public static Expression sync(Expression channel, Synchronisation sync) {
		return Expression.createSync(channel, sync, loc());
	}

	public static Expression spawn(Symbol template, Expression... arguments) {
		List<Expression> children = new ArrayList<>(arguments.length + 1);
		children.add(id(template));
		children.addAll(Arrays.asList(arguments));
		return Expression.createNary(ExpressionKind.SPAWN, children, loc(), Type.unknown());
	}

	public static Expression numOf(Symbol template) {
		return unary(ExpressionKind.NUMOF, id(template));
	}

	public static Expression exit() {
		return Expression.createNary(ExpressionKind.EXIT, Collections.emptyList(), loc(), Type.unknown());
	}

	public static Expression deadlock() {
		return Expression.createNary(ExpressionKind.DEADLOCK, Collections.emptyList(), loc(),
				Type.primitive(TypeKind.CONSTRAINT));
	}
}
