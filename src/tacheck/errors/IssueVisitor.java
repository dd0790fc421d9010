package tacheck.errors;

import tacheck.trans.passes.typecheck.InternalConsistencyIssue;
import tacheck.trans.passes.typecheck.TypeCheckingIssue;
import tacheck.trans.passes.typecheck.TypeCheckingWarning;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(TypeCheckingIssue typeCheckingIssue) throws E;
	public abstract T visit(TypeCheckingWarning typeCheckingWarning) throws E;
	public abstract T visit(InternalConsistencyIssue internalConsistencyIssue) throws E;
}
