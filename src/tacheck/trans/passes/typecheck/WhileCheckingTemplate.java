package tacheck.trans.passes.typecheck;

import tacheck.errors.Context;
import tacheck.errors.ContextVisitor;
import tacheck.model.system.Template;

public class WhileCheckingTemplate extends Context {

	private final Template template;

	public WhileCheckingTemplate(Template template) {
		this.template = template;
	}

	public Template getTemplate() {
		return template;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}

}
