package tacheck.formatters;

import tacheck.errors.IssueVisitor;
import tacheck.errors.IssueWithContext;
import tacheck.trans.passes.typecheck.InternalConsistencyIssue;
import tacheck.trans.passes.typecheck.TypeCheckingIssue;
import tacheck.trans.passes.typecheck.TypeCheckingWarning;
import tacheck.util.SourceLocation;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeLocation(SourceLocation location) throws IOException {
		if (location == null || location.isUnknown()) {
			return;
		}
		out.write(location.getName());
		out.write(":");
		out.write(Integer.toString(location.getStartLine()));
		out.write(":");
		out.write(Integer.toString(location.getStartColumn()));
		out.write(": ");
	}

	private void writeDetail(String detail) throws IOException {
		if (detail != null && !detail.isEmpty()) {
			out.write(" (");
			out.write(detail);
			out.write(")");
		}
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(TypeCheckingIssue typeCheckingIssue) throws IOException {
		writeLocation(typeCheckingIssue.getLocation());
		out.write(typeCheckingIssue.getReason().getDescription());
		writeDetail(typeCheckingIssue.getDetail());
		return null;
	}

	@Override
	public Void visit(TypeCheckingWarning typeCheckingWarning) throws IOException {
		writeLocation(typeCheckingWarning.getLocation());
		out.write(typeCheckingWarning.getReason().getDescription());
		writeDetail(typeCheckingWarning.getDetail());
		return null;
	}

	@Override
	public Void visit(InternalConsistencyIssue internalConsistencyIssue) throws IOException {
		writeLocation(internalConsistencyIssue.getLocation());
		out.write("Bug: ");
		out.write(internalConsistencyIssue.getDescription());
		return null;
	}

}
