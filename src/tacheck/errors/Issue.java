package tacheck.errors;

import tacheck.TACheckException;
import tacheck.Unreachable;
import tacheck.formatters.IndentingWriter;
import tacheck.formatters.IssueFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

public abstract class Issue extends TACheckException {
	private static final String prefix = "Type Checking Issue";

	public Issue() {
		super(prefix, "");
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e); // string ops don't throw IO exceptions
		}
		return sw.getBuffer().toString();
	}

	public Issue withContext(Context ctx) {
		return new IssueWithContext(this, ctx);
	}

	/**
	 * @return this issue with any surrounding contexts removed
	 */
	public Issue unwrap() {
		return this;
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}
