package tacheck.trans.passes.typecheck;

import tacheck.errors.Issue;
import tacheck.errors.IssueVisitor;
import tacheck.util.SourceLocation;

/**
 * Reported when an expression is not shaped the way the builder is supposed to encode it, e.g. a
 * probability query with the wrong number of operands. These point at a bug in whatever built the
 * model rather than at the model itself.
 */
public class InternalConsistencyIssue extends Issue {

	public enum Reason {
		WRONG_NUMBER_OF_ARGUMENTS("wrong number of arguments"),
		BAD_PATH_QUANTIFIER("bad path quantifier"),
		BAD_AGGREGATION_OPERATOR("bad aggregation operator expression"),
		BAD_AGGREGATION_OPERATOR_VALUE("bad aggregation operator value");

		private final String description;

		Reason(String description) {
			this.description = description;
		}

		public String getDescription() {
			return description;
		}
	}

	private final Reason reason;
	private final SourceLocation location;

	public InternalConsistencyIssue(Reason reason, SourceLocation location) {
		this.reason = reason;
		this.location = location;
	}

	public Reason getReason() {
		return reason;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public String getDescription() {
		return reason.getDescription();
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
