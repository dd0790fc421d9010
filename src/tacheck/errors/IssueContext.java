package tacheck.errors;

public abstract class IssueContext {

	public abstract void error(Issue err);

	public abstract void warning(Issue warning);

	public abstract boolean hasErrors();

	public abstract boolean hasWarnings();

	public IssueContext withContext(Context context) {
		return new NestedIssueContext(this, context);
	}
}
