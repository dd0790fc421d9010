package tacheck.model.system;

import tacheck.model.expr.Expression;
import tacheck.scope.Frame;
import tacheck.scope.Symbol;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A (partial) instantiation of a template. The parameter frame starts with the {@code unbound}
 * parameters that remain free, followed by the {@code arguments} template parameters that are
 * bound to an argument through the mapping.
 */
public class Instance {

	private Symbol uid;
	private final Template template;
	private final Frame parameters;
	private final Map<Symbol, Expression> mapping = new LinkedHashMap<>();
	private final int unbound;
	private final int arguments;
	private final Set<Symbol> restricted = new HashSet<>();

	Instance(Template template, Frame parameters, int unbound, int arguments) {
		this.template = template;
		this.parameters = parameters;
		this.unbound = unbound;
		this.arguments = arguments;
	}

	void setUid(Symbol uid) {
		this.uid = uid;
	}

	public Symbol getUid() {
		return uid;
	}

	public String getName() {
		return uid.getName();
	}

	public Template getTemplate() {
		return template;
	}

	public Frame getParameters() {
		return parameters;
	}

	public Map<Symbol, Expression> getMapping() {
		return Collections.unmodifiableMap(mapping);
	}

	void bind(Symbol parameter, Expression argument) {
		mapping.put(parameter, argument);
	}

	public int getUnbound() {
		return unbound;
	}

	public int getArguments() {
		return arguments;
	}

	/**
	 * @return the parameters used, directly or indirectly, in array sizes or select expressions
	 */
	public Set<Symbol> getRestricted() {
		return Collections.unmodifiableSet(restricted);
	}

	public void addRestricted(Symbol parameter) {
		restricted.add(parameter);
	}

	@Override
	public String toString() {
		return getName();
	}

}
