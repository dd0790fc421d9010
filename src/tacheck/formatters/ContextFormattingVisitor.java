package tacheck.formatters;

import tacheck.errors.ContextVisitor;
import tacheck.trans.passes.typecheck.WhileCheckingTemplate;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(WhileCheckingTemplate whileCheckingTemplate) throws IOException {
		out.write("while checking template ");
		out.write(whileCheckingTemplate.getTemplate().getName());
		return null;
	}

}
