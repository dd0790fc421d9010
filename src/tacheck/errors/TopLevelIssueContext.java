package tacheck.errors;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

import tacheck.formatters.IndentingWriter;
import tacheck.formatters.IssueFormattingVisitor;

public class TopLevelIssueContext extends IssueContext {

	List<Issue> errors;
	List<Issue> warnings;

	public TopLevelIssueContext() {
		this.errors = new ArrayList<>();
		this.warnings = new ArrayList<>();
	}

	@Override
	public void error(Issue err) {
		errors.add(err);
	}

	@Override
	public void warning(Issue warning) {
		warnings.add(warning);
	}

	@Override
	public boolean hasErrors() {
		return !errors.isEmpty();
	}

	@Override
	public boolean hasWarnings() {
		return !warnings.isEmpty();
	}

	public List<Issue> getIssues() {
		return errors;
	}

	public List<Issue> getWarnings() {
		return warnings;
	}

	public void format(IndentingWriter out) throws IOException {
		out.write("Detected ");
		out.write(Integer.toString(errors.size()));
		out.write(" error(s) and ");
		out.write(Integer.toString(warnings.size()));
		out.write(" warning(s):");
		for (Issue e : errors) {
			out.newLine();
			out.write("error: ");
			e.accept(new IssueFormattingVisitor(out));
		}
		for (Issue w : warnings) {
			out.newLine();
			out.write("warning: ");
			w.accept(new IssueFormattingVisitor(out));
		}
	}

	public String format() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			format(out);
		} catch (IOException e) {
			throw new RuntimeException("StringWriter should not throw IOException", e);
		}
		return w.toString();
	}
}
