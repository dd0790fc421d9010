package tacheck.model.type;

import tacheck.model.expr.Expression;
import tacheck.util.SourceLocatable;
import tacheck.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A type of the modelling language. Types are layered: prefixes such as const or urgent, type
 * name labels and ranges wrap the type they qualify as their first sub-type. Most predicates below
 * look through these layers, see {@link TypeKind#isTransparent()}.
 *
 * Types are immutable.
 */
public final class Type extends SourceLocatable {

	private static final Type UNKNOWN = new Type(TypeKind.UNKNOWN, SourceLocation.unknown(),
			Collections.emptyList(), Collections.emptyList(), null, null);

	private final TypeKind kind;
	private final SourceLocation location;
	private final List<Type> subs;
	private final List<String> labels;
	// bounds, only set for RANGE
	private final Expression lower;
	private final Expression upper;

	private Type(TypeKind kind, SourceLocation location, List<Type> subs, List<String> labels,
	             Expression lower, Expression upper) {
		this.kind = kind;
		this.location = location;
		this.subs = subs;
		this.labels = labels;
		this.lower = lower;
		this.upper = upper;
	}

	public static Type unknown() {
		return UNKNOWN;
	}

	public static Type primitive(TypeKind kind) {
		return new Type(kind, SourceLocation.unknown(), Collections.emptyList(), Collections.emptyList(),
				null, null);
	}

	public static Type prefix(TypeKind prefix, Type sub) {
		if (!prefix.isPrefix()) {
			throw new IllegalArgumentException(prefix + " is not a type prefix");
		}
		return new Type(prefix, SourceLocation.unknown(), Collections.singletonList(sub),
				Collections.emptyList(), null, null);
	}

	public static Type label(String name, Type sub) {
		return new Type(TypeKind.LABEL, SourceLocation.unknown(), Collections.singletonList(sub),
				Collections.singletonList(name), null, null);
	}

	public static Type range(Type base, Expression lower, Expression upper) {
		return new Type(TypeKind.RANGE, SourceLocation.unknown(), Collections.singletonList(base),
				Collections.emptyList(), lower, upper);
	}

	public static Type array(Type element, Type size) {
		List<Type> subs = new ArrayList<>(2);
		subs.add(element);
		subs.add(size);
		return new Type(TypeKind.ARRAY, SourceLocation.unknown(), Collections.unmodifiableList(subs),
				Collections.emptyList(), null, null);
	}

	/**
	 * Creates a record type. Unlabelled entries, as produced for list literals, use the empty
	 * string as their label.
	 */
	public static Type record(List<Type> fields, List<String> labels) {
		if (fields.size() != labels.size()) {
			throw new IllegalArgumentException("record needs one label per field");
		}
		return new Type(TypeKind.RECORD, SourceLocation.unknown(),
				Collections.unmodifiableList(new ArrayList<>(fields)),
				Collections.unmodifiableList(new ArrayList<>(labels)), null, null);
	}

	/**
	 * The first sub-type of a function type is its return type, followed by one sub-type per
	 * parameter.
	 */
	public static Type function(Type returnType, List<Type> parameters) {
		List<Type> subs = new ArrayList<>(parameters.size() + 1);
		subs.add(returnType);
		subs.addAll(parameters);
		return new Type(TypeKind.FUNCTION, SourceLocation.unknown(), Collections.unmodifiableList(subs),
				Collections.emptyList(), null, null);
	}

	public static Type process(List<Type> parameters) {
		return new Type(TypeKind.PROCESS, SourceLocation.unknown(),
				Collections.unmodifiableList(new ArrayList<>(parameters)), Collections.emptyList(), null, null);
	}

	public static Type instance(List<Type> parameters) {
		return new Type(TypeKind.INSTANCE, SourceLocation.unknown(),
				Collections.unmodifiableList(new ArrayList<>(parameters)), Collections.emptyList(), null, null);
	}

	public Type at(SourceLocation location) {
		return new Type(kind, location, subs, labels, lower, upper);
	}

	public TypeKind getKind() {
		return kind;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public int size() {
		return subs.size();
	}

	/**
	 * @return the i-th immediate sub-type, without looking through prefixes
	 */
	public Type get(int i) {
		return subs.get(i);
	}

	public String getLabel(int i) {
		return labels.get(i);
	}

	public boolean isUnknown() {
		return kind == TypeKind.UNKNOWN;
	}

	public boolean is(TypeKind k) {
		if (kind == k) {
			return true;
		}
		return kind.isTransparent() && !subs.isEmpty() && subs.get(0).is(k);
	}

	private Type strip(TypeKind k) {
		Type t = this;
		while (t.kind != k) {
			if (!t.kind.isTransparent() || t.subs.isEmpty()) {
				throw new IllegalStateException("type " + this + " is not of kind " + k);
			}
			t = t.subs.get(0);
		}
		return t;
	}

	public boolean isIntegral() {
		return is(TypeKind.INT) || is(TypeKind.BOOL);
	}

	public boolean isInteger() {
		return is(TypeKind.INT);
	}

	public boolean isBoolean() {
		return is(TypeKind.BOOL);
	}

	public boolean isClock() {
		return is(TypeKind.CLOCK);
	}

	public boolean isCost() {
		return is(TypeKind.COST);
	}

	public boolean isDiff() {
		return is(TypeKind.DIFF);
	}

	public boolean isDouble() {
		return is(TypeKind.DOUBLE);
	}

	public boolean isScalar() {
		return is(TypeKind.SCALAR);
	}

	public boolean isChannel() {
		return is(TypeKind.CHANNEL);
	}

	public boolean isLocation() {
		return is(TypeKind.LOCATION);
	}

	public boolean isRecord() {
		return is(TypeKind.RECORD);
	}

	public boolean isArray() {
		return is(TypeKind.ARRAY);
	}

	public boolean isRange() {
		return is(TypeKind.RANGE);
	}

	public boolean isProcess() {
		return is(TypeKind.PROCESS);
	}

	public boolean isFunction() {
		return is(TypeKind.FUNCTION);
	}

	public boolean isVoid() {
		return is(TypeKind.VOID);
	}

	public boolean isInvariant() {
		return is(TypeKind.INVARIANT) || isIntegral();
	}

	public boolean isInvariantWR() {
		return isInvariant() || is(TypeKind.INVARIANT_WR);
	}

	public boolean isGuard() {
		return is(TypeKind.GUARD) || isInvariant();
	}

	public boolean isConstraint() {
		return is(TypeKind.CONSTRAINT) || isGuard();
	}

	public boolean isFormula() {
		return is(TypeKind.FORMULA) || isConstraint();
	}

	/**
	 * A type is constant if values of it can never change, e.g. const int, or a struct whose
	 * fields are all constant.
	 */
	public boolean isConstant() {
		switch (kind) {
			case FUNCTION:
			case PROCESS:
			case INSTANCE:
				return false;
			case CONSTANT:
				return true;
			case RECORD:
				if (subs.isEmpty()) {
					return false;
				}
				for (Type field : subs) {
					if (!field.isConstant()) {
						return false;
					}
				}
				return true;
			default:
				return !subs.isEmpty() && subs.get(0).isConstant();
		}
	}

	/**
	 * A type is non-constant if some part of a value of it can change. Note that a struct can be
	 * neither constant nor non-constant when it has no fields.
	 */
	public boolean isNonConstant() {
		switch (kind) {
			case FUNCTION:
			case PROCESS:
			case INSTANCE:
			case CONSTANT:
				return false;
			case RECORD:
				for (Type field : subs) {
					if (field.isNonConstant()) {
						return true;
					}
				}
				return false;
			default:
				return subs.isEmpty() || subs.get(0).isNonConstant();
		}
	}

	/**
	 * @return the element type of an array type
	 */
	public Type getSub() {
		return strip(TypeKind.ARRAY).subs.get(0);
	}

	/**
	 * @return the type of the i-th field of a record type
	 */
	public Type getSub(int i) {
		return strip(TypeKind.RECORD).subs.get(i);
	}

	public Type getArraySize() {
		return strip(TypeKind.ARRAY).subs.get(1);
	}

	public Expression getLowerBound() {
		return strip(TypeKind.RANGE).lower;
	}

	public Expression getUpperBound() {
		return strip(TypeKind.RANGE).upper;
	}

	public int getRecordSize() {
		return strip(TypeKind.RECORD).subs.size();
	}

	public String getRecordLabel(int i) {
		return strip(TypeKind.RECORD).labels.get(i);
	}

	/**
	 * @return the index of the record field with the given name, or -1
	 */
	public int findIndexOf(String label) {
		return strip(TypeKind.RECORD).labels.indexOf(label);
	}

	/**
	 * @return the innermost element type of a (possibly multi-dimensional) array type
	 */
	public Type stripArray() {
		Type t = this;
		while (t.isArray()) {
			t = t.getSub();
		}
		return t;
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, subs, labels, lower, upper);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		Type other = (Type) obj;
		return kind == other.kind && subs.equals(other.subs) && labels.equals(other.labels) &&
				Objects.equals(lower, other.lower) && Objects.equals(upper, other.upper);
	}

	@Override
	public String toString() {
		StringBuilder b = new StringBuilder();
		switch (kind) {
			case LABEL:
				b.append(labels.get(0));
				break;
			case RANGE:
				b.append(subs.get(0)).append('[').append(lower).append(',').append(upper).append(']');
				break;
			case ARRAY:
				b.append(subs.get(0)).append('[').append(subs.get(1)).append(']');
				break;
			case RECORD:
				b.append("struct {");
				for (int i = 0; i < subs.size(); ++i) {
					b.append(' ').append(subs.get(i));
					if (!labels.get(i).isEmpty()) {
						b.append(' ').append(labels.get(i));
					}
					b.append(';');
				}
				b.append(" }");
				break;
			case FUNCTION:
				b.append(subs.get(0)).append('(');
				for (int i = 1; i < subs.size(); ++i) {
					if (i > 1) {
						b.append(", ");
					}
					b.append(subs.get(i));
				}
				b.append(')');
				break;
			case PROCESS:
			case INSTANCE:
				b.append(kind.getText()).append('(');
				for (int i = 0; i < subs.size(); ++i) {
					if (i > 0) {
						b.append(", ");
					}
					b.append(subs.get(i));
				}
				b.append(')');
				break;
			default:
				b.append(kind.getText());
				if (kind.isPrefix()) {
					b.append(' ').append(subs.get(0));
				}
		}
		return b.toString();
	}

}
