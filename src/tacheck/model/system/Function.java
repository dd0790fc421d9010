package tacheck.model.system;

import tacheck.model.stmt.BlockStatement;
import tacheck.model.type.Type;
import tacheck.scope.Frame;
import tacheck.scope.Symbol;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A user defined function. The first symbols of the body's frame are the parameters, in
 * declaration order. The sets of symbols the function may change or depend on only cover
 * external symbols and are filled in by the type checker.
 */
public class Function {

	private Symbol symbol;
	private final BlockStatement body;
	private final List<Variable> variables;
	private final Set<Symbol> changes = new HashSet<>();
	private final Set<Symbol> depends = new HashSet<>();

	private Function(BlockStatement body, List<Variable> variables) {
		this.body = body;
		this.variables = variables;
	}

	/**
	 * Declares a function in the given frame.
	 *
	 * @param type a function type, see {@link Type#function(Type, List)}
	 * @param body the body, whose frame starts with one symbol per parameter
	 * @param variables the local variables declared anywhere in the body
	 */
	public static Function declare(Frame frame, String name, Type type, BlockStatement body,
	                               List<Variable> variables) {
		Function function = new Function(body, variables);
		function.symbol = frame.add(name, type, function);
		return function;
	}

	public Symbol getSymbol() {
		return symbol;
	}

	public Type getReturnType() {
		return symbol.getType().get(0);
	}

	public int getParameterCount() {
		return symbol.getType().size() - 1;
	}

	public BlockStatement getBody() {
		return body;
	}

	public List<Variable> getVariables() {
		return Collections.unmodifiableList(variables);
	}

	public Set<Symbol> getChanges() {
		return changes;
	}

	public Set<Symbol> getDepends() {
		return depends;
	}

	@Override
	public String toString() {
		return symbol.getName();
	}

}
