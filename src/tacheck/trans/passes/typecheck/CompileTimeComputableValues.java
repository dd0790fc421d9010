package tacheck.trans.passes.typecheck;

import tacheck.model.system.Instance;
import tacheck.model.system.SystemVisitor;
import tacheck.model.system.Variable;
import tacheck.model.type.Type;
import tacheck.model.type.TypeKind;
import tacheck.scope.Frame;
import tacheck.scope.Symbol;

import java.util.HashSet;
import java.util.Set;

/**
 * The symbols whose values are known before the model runs: declared constants, and the
 * constant non-reference parameters of templates and instances, whose values are fixed when
 * the system is instantiated. Doubles are excluded.
 */
public class CompileTimeComputableValues extends SystemVisitor {

	private final Set<Symbol> symbols = new HashSet<>();

	@Override
	public void visitVariable(Variable variable) {
		if (variable.getUid().getType().isConstant()) {
			symbols.add(variable.getUid());
		}
	}

	@Override
	public void visitInstance(Instance instance) {
		Frame parameters = instance.getParameters();
		for (Symbol parameter : parameters.getSymbols()) {
			Type type = parameter.getType();
			if (!type.is(TypeKind.REF) && type.isConstant() && !type.isDouble()) {
				symbols.add(parameter);
			}
		}
	}

	public boolean contains(Symbol symbol) {
		return symbols.contains(symbol);
	}

}
