package tacheck.model.type;

import tacheck.model.expr.ExpressionBuilder;
import tacheck.model.expr.Expression;

import java.util.Arrays;
import java.util.List;

/**
 * Shorthands for building types programmatically, e.g. when declaring symbols for a model that
 * was not produced by a parser.
 */
public class TypeBuilder {
	private TypeBuilder() {}

	public static Type intType() {
		return Type.primitive(TypeKind.INT);
	}

	public static Type boolType() {
		return Type.primitive(TypeKind.BOOL);
	}

	public static Type doubleType() {
		return Type.primitive(TypeKind.DOUBLE);
	}

	public static Type clockType() {
		return Type.primitive(TypeKind.CLOCK);
	}

	public static Type costType() {
		return Type.primitive(TypeKind.COST);
	}

	public static Type chanType() {
		return Type.primitive(TypeKind.CHANNEL);
	}

	public static Type voidType() {
		return Type.primitive(TypeKind.VOID);
	}

	public static Type locationType() {
		return Type.primitive(TypeKind.LOCATION);
	}

	public static Type constant(Type type) {
		return Type.prefix(TypeKind.CONSTANT, type);
	}

	public static Type meta(Type type) {
		return Type.prefix(TypeKind.SYSTEM_META, type);
	}

	public static Type ref(Type type) {
		return Type.prefix(TypeKind.REF, type);
	}

	public static Type urgent(Type type) {
		return Type.prefix(TypeKind.URGENT, type);
	}

	public static Type broadcast(Type type) {
		return Type.prefix(TypeKind.BROADCAST, type);
	}

	public static Type committed(Type type) {
		return Type.prefix(TypeKind.COMMITTED, type);
	}

	public static Type hybrid(Type type) {
		return Type.prefix(TypeKind.HYBRID, type);
	}

	public static Type range(Type base, Expression lower, Expression upper) {
		return Type.range(base, lower, upper);
	}

	/**
	 * @return the bounded integer type int[lower,upper]
	 */
	public static Type range(int lower, int upper) {
		return Type.range(intType(), ExpressionBuilder.num(lower), ExpressionBuilder.num(upper));
	}

	/**
	 * @return a named scalar set with the given number of elements
	 */
	public static Type scalar(String name, int size) {
		return Type.label(name, Type.range(Type.primitive(TypeKind.SCALAR), ExpressionBuilder.num(0),
				ExpressionBuilder.num(size - 1)));
	}

	public static Type array(Type element, Type size) {
		return Type.array(element, size);
	}

	/**
	 * @return an array with elements indexed 0 to length-1
	 */
	public static Type array(Type element, int length) {
		return Type.array(element, range(0, length - 1));
	}

	public static Type record(List<String> labels, List<Type> fields) {
		return Type.record(fields, labels);
	}

	public static Type typedef(String name, Type type) {
		return Type.label(name, type);
	}

	public static Type function(Type returnType, Type... parameters) {
		return Type.function(returnType, Arrays.asList(parameters));
	}

	public static Type process(Type... parameters) {
		return Type.process(Arrays.asList(parameters));
	}

	public static Type instance(Type... parameters) {
		return Type.instance(Arrays.asList(parameters));
	}
}
