package tacheck.scope;

import tacheck.model.type.Type;

/**
 * A named entity declared in a {@link Frame}. Symbols are compared by identity: two declarations
 * with the same name in different scopes are different symbols.
 *
 * The optional data links the symbol back to the declaration it was created for, e.g. a
 * {@link tacheck.model.system.Variable} or a {@link tacheck.model.system.Function}.
 */
public class Symbol {

	private final String name;
	private final Type type;
	private final Frame frame;
	private Object data;

	Symbol(Frame frame, String name, Type type, Object data) {
		this.frame = frame;
		this.name = name;
		this.type = type;
		this.data = data;
	}

	public String getName() {
		return name;
	}

	public Type getType() {
		return type;
	}

	public Frame getFrame() {
		return frame;
	}

	public Object getData() {
		return data;
	}

	public void setData(Object data) {
		this.data = data;
	}

	@Override
	public String toString() {
		return name;
	}

}
