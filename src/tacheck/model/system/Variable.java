package tacheck.model.system;

import tacheck.model.expr.Expression;
import tacheck.model.type.Type;
import tacheck.scope.Frame;
import tacheck.scope.Symbol;

/**
 * A declared variable or constant together with its initialiser. The initialiser may be
 * replaced during type checking, e.g. when a record initialiser is reordered into declaration
 * order.
 */
public class Variable {

	private Symbol uid;
	private Expression init;

	private Variable(Expression init) {
		this.init = init;
	}

	/**
	 * Declares a new variable in the given frame. The resulting symbol refers back to the
	 * variable through its data.
	 */
	public static Variable declare(Frame frame, String name, Type type, Expression init) {
		Variable variable = new Variable(init);
		variable.uid = frame.add(name, type, variable);
		return variable;
	}

	public Symbol getUid() {
		return uid;
	}

	public Expression getInit() {
		return init;
	}

	public void setInit(Expression init) {
		this.init = init;
	}

	@Override
	public String toString() {
		return uid.getName();
	}

}
