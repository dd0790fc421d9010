package tacheck.model.expr;

import tacheck.model.system.Function;
import tacheck.model.type.Type;
import tacheck.model.type.TypeKind;
import tacheck.scope.Symbol;
import tacheck.util.SourceLocatable;
import tacheck.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An expression of the modelling language.
 *
 * Every expression carries an inferred type slot. It starts out as whatever the builder could
 * determine from declarations alone (identifiers, constants, list literals, field accesses, calls)
 * and {@link Type#unknown()} otherwise; the type checker fills it in. Since the slot lives on the
 * node itself, two checking passes must never run concurrently over the same expression.
 *
 * Absent expressions (an edge without a guard, a return without a value) are represented as null.
 */
public class Expression extends SourceLocatable {

	private final ExpressionKind kind;
	private final SourceLocation location;
	private final List<Expression> children;
	private final int value;
	private final double doubleValue;
	private final Symbol symbol;
	private final Synchronisation sync;
	private Type type;

	private Expression(ExpressionKind kind, SourceLocation location, List<Expression> children, int value,
	                   double doubleValue, Symbol symbol, Synchronisation sync, Type type) {
		this.kind = kind;
		this.location = location;
		this.children = children;
		this.value = value;
		this.doubleValue = doubleValue;
		this.symbol = symbol;
		this.sync = sync;
		this.type = type;
	}

	private static List<Expression> childList(Expression... children) {
		for (Expression child : children) {
			Objects.requireNonNull(child, "operand");
		}
		List<Expression> list = new ArrayList<>(children.length);
		Collections.addAll(list, children);
		return Collections.unmodifiableList(list);
	}

	public static Expression createConstant(int value, Type type, SourceLocation location) {
		return new Expression(ExpressionKind.CONSTANT, location, Collections.emptyList(), value, value,
				null, null, type);
	}

	public static Expression createDouble(double value, Type type, SourceLocation location) {
		return new Expression(ExpressionKind.CONSTANT, location, Collections.emptyList(), (int) value, value,
				null, null, type);
	}

	public static Expression createIdentifier(Symbol symbol, SourceLocation location) {
		return new Expression(ExpressionKind.IDENTIFIER, location, Collections.emptyList(), 0, 0, symbol,
				null, symbol.getType());
	}

	public static Expression createUnary(ExpressionKind kind, Expression operand, SourceLocation location,
	                                     Type type) {
		return new Expression(kind, location, childList(operand), 0, 0, null, null, type);
	}

	public static Expression createBinary(ExpressionKind kind, Expression left, Expression right,
	                                      SourceLocation location, Type type) {
		return new Expression(kind, location, childList(left, right), 0, 0, null, null, type);
	}

	public static Expression createTernary(ExpressionKind kind, Expression first, Expression second,
	                                       Expression third, SourceLocation location, Type type) {
		return new Expression(kind, location, childList(first, second, third), 0, 0, null, null, type);
	}

	public static Expression createNary(ExpressionKind kind, List<Expression> children, SourceLocation location,
	                                    Type type) {
		return new Expression(kind, location, childList(children.toArray(new Expression[0])), 0, 0, null,
				null, type);
	}

	/**
	 * Creates the access to field number index of a record (or process) valued expression.
	 */
	public static Expression createDot(Expression operand, int index, SourceLocation location, Type type) {
		return new Expression(ExpressionKind.DOT, location, childList(operand), index, index, null, null,
				type);
	}

	public static Expression createSync(Expression channel, Synchronisation sync, SourceLocation location) {
		return new Expression(ExpressionKind.SYNC, location, childList(channel), 0, 0, null,
				Objects.requireNonNull(sync), Type.primitive(TypeKind.VOID));
	}

	public ExpressionKind getKind() {
		return kind;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public int getSize() {
		return children.size();
	}

	public Expression get(int i) {
		return children.get(i);
	}

	public List<Expression> getChildren() {
		return children;
	}

	public int getValue() {
		return value;
	}

	public double getDoubleValue() {
		return doubleValue;
	}

	/**
	 * @return the index of the field selected by a DOT expression
	 */
	public int getIndex() {
		return value;
	}

	public Synchronisation getSync() {
		return sync;
	}

	public Type getType() {
		return type;
	}

	public void setType(Type type) {
		this.type = Objects.requireNonNull(type);
	}

	/**
	 * @return the symbol designated by this expression: the identifier itself, or the variable
	 * an array element, field, assignment or call refers to. null if there is none.
	 */
	public Symbol getSymbol() {
		switch (kind) {
			case IDENTIFIER:
				return symbol;
			case DOT:
			case ARRAY:
			case PREINCREMENT:
			case PREDECREMENT:
			case FUNCALL:
			case SYNC:
				return children.get(0).getSymbol();
			case INLINEIF:
				return children.get(1).getSymbol();
			case COMMA:
				return children.get(1).getSymbol();
			default:
				if (kind.isAssignment()) {
					return children.get(0).getSymbol();
				}
				return null;
		}
	}

	/**
	 * Adds every symbol this expression may designate as an lvalue. Both branches of an inline if
	 * count.
	 */
	public void collectSymbols(Set<Symbol> symbols) {
		switch (kind) {
			case IDENTIFIER:
				symbols.add(symbol);
				break;
			case DOT:
			case ARRAY:
			case PREINCREMENT:
			case PREDECREMENT:
			case SYNC:
				children.get(0).collectSymbols(symbols);
				break;
			case INLINEIF:
				children.get(1).collectSymbols(symbols);
				children.get(2).collectSymbols(symbols);
				break;
			case COMMA:
				children.get(1).collectSymbols(symbols);
				break;
			default:
				if (kind.isAssignment()) {
					children.get(0).collectSymbols(symbols);
				}
		}
	}

	private Function calledFunction() {
		Symbol callee = children.get(0).getSymbol();
		if (callee != null && callee.getType().isFunction() && callee.getData() instanceof Function) {
			return (Function) callee.getData();
		}
		return null;
	}

	/**
	 * Adds every symbol whose value evaluating this expression may read, including the external
	 * dependencies of called functions.
	 */
	public void collectPossibleReads(Set<Symbol> reads) {
		for (Expression child : children) {
			child.collectPossibleReads(reads);
		}
		if (kind == ExpressionKind.IDENTIFIER) {
			reads.add(symbol);
		} else if (kind == ExpressionKind.FUNCALL) {
			Function function = calledFunction();
			if (function != null) {
				reads.addAll(function.getDepends());
			}
		}
	}

	/**
	 * Adds every symbol evaluating this expression may change: targets of assignments and
	 * increments, variables changed by called functions, and arguments passed to non-constant
	 * reference parameters.
	 */
	public void collectPossibleWrites(Set<Symbol> writes) {
		for (Expression child : children) {
			child.collectPossibleWrites(writes);
		}
		if (kind.isAssignment() || kind.isIncrementOrDecrement()) {
			children.get(0).collectSymbols(writes);
		} else if (kind == ExpressionKind.FUNCALL) {
			Function function = calledFunction();
			if (function != null) {
				writes.addAll(function.getChanges());
				Type functionType = function.getSymbol().getType();
				int n = Math.min(children.size(), functionType.size());
				for (int i = 1; i < n; ++i) {
					Type parameter = functionType.get(i);
					if (parameter.is(TypeKind.REF) && !parameter.isConstant()) {
						children.get(i).collectSymbols(writes);
					}
				}
			}
		}
	}

	public boolean changesAnyVariable() {
		Set<Symbol> writes = new HashSet<>();
		collectPossibleWrites(writes);
		return !writes.isEmpty();
	}

	/**
	 * @return whether evaluating this expression draws a random number
	 */
	public boolean dependsOnRandom() {
		if (kind.isRandom()) {
			return true;
		}
		for (Expression child : children) {
			if (child.dependsOnRandom()) {
				return true;
			}
		}
		return false;
	}

	/**
	 * @return whether this expression creates, destroys or inspects dynamic processes
	 */
	public boolean isDynamic() {
		return kind.isDynamic();
	}

	public boolean hasDynamicSub() {
		for (Expression child : children) {
			if (child.isDynamic() || child.hasDynamicSub()) {
				return true;
			}
		}
		return false;
	}

	/**
	 * @return whether this is the constant true, i.e. an integral constant other than 0
	 */
	public boolean isTrue() {
		return kind == ExpressionKind.CONSTANT && type.isIntegral() && value != 0;
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, children, value, Double.hashCode(doubleValue), symbol, sync);
	}

	/**
	 * Structural equality. The inferred type and the source location are not compared.
	 */
	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		Expression other = (Expression) obj;
		return kind == other.kind && value == other.value &&
				Double.compare(doubleValue, other.doubleValue) == 0 && symbol == other.symbol &&
				sync == other.sync && children.equals(other.children);
	}

	@Override
	public String toString() {
		switch (kind) {
			case IDENTIFIER:
				return symbol.getName();
			case CONSTANT:
				if (type.isDouble()) {
					return Double.toString(doubleValue);
				}
				if (type.isBoolean()) {
					return value != 0 ? "true" : "false";
				}
				return Integer.toString(value);
			case DEADLOCK:
				return "deadlock";
			case ARRAY:
				return children.get(0) + "[" + children.get(1) + "]";
			case DOT: {
				Type operand = children.get(0).getType();
				if (operand.isRecord()) {
					return children.get(0) + "." + operand.getRecordLabel(value);
				}
				return children.get(0) + ".#" + value;
			}
			case INLINEIF:
				return "(" + children.get(0) + " ? " + children.get(1) + " : " + children.get(2) + ")";
			case NOT:
			case UNARY_MINUS:
			case PREINCREMENT:
			case PREDECREMENT:
				return kind.getSymbol() + children.get(0);
			case POSTINCREMENT:
			case POSTDECREMENT:
			case RATE:
				return children.get(0) + kind.getSymbol();
			case LIST:
				return children.stream().map(Expression::toString).collect(Collectors.joining(", ", "{ ", " }"));
			case FUNCALL:
				return children.get(0) + children.subList(1, children.size()).stream()
						.map(Expression::toString).collect(Collectors.joining(", ", "(", ")"));
			case SYNC:
				switch (sync) {
					case BANG:
						return children.get(0) + "!";
					case QUE:
						return children.get(0) + "?";
					default:
						return children.get(0).toString();
				}
			case FORALL:
			case EXISTS:
			case SUM:
				return kind.getSymbol() + " (" + children.get(0) + " : " + children.get(0).getType() + ") " +
						children.get(1);
			default:
				if (kind.isInfix() && children.size() == 2) {
					return "(" + children.get(0) + " " + kind.getSymbol() + " " + children.get(1) + ")";
				}
				return kind.getSymbol() + children.stream().map(Expression::toString)
						.collect(Collectors.joining(", ", "(", ")"));
		}
	}

}
