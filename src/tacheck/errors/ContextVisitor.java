package tacheck.errors;

import tacheck.trans.passes.typecheck.WhileCheckingTemplate;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(WhileCheckingTemplate whileCheckingTemplate) throws E;

}
