package tacheck.trans.passes.typecheck;

import tacheck.errors.Issue;
import tacheck.errors.IssueVisitor;
import tacheck.util.SourceLocation;

/**
 * An advisory about a model that type checks but is likely not what the modeller meant, or is
 * expensive for the engine to handle.
 */
public class TypeCheckingWarning extends Issue {

	public enum Reason {
		EXPRESSION_HAS_NO_EFFECT("expression does not have any effect"),
		CLOCK_GUARD_ON_URGENT_EDGE("clock guards are not allowed on urgent edges"),
		EXPENSIVE_BROADCAST_GUARD("clock guards on broadcast receivers are expensive"),
		NONDETERMINISTIC_BROADCAST_INPUT("SMC requires input edges to be deterministic"),
		TARGET_INVARIANT_GUARD_NEEDED("it may be needed to add a guard involving the target invariant"),
		STRICT_BOUND_ON_URGENT_EDGE("strict bounds on urgent edges may not make sense"),
		OUTPUT_SHOULD_BE_UNCONTROLLABLE("outputs should be uncontrollable for refinement checking"),
		INPUT_SHOULD_BE_CONTROLLABLE("inputs should be controllable for refinement checking"),
		CSP_INCOMPATIBLE_WITH_REFINEMENT("CSP synchronisations are incompatible with refinement checking"),
		STRICT_INVARIANT("strict invariant");

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
	private final String detail;

	public TypeCheckingWarning(Reason reason, SourceLocation location) {
		this(reason, location, null);
	}

	public TypeCheckingWarning(Reason reason, SourceLocation location, String detail) {
		this.reason = reason;
		this.location = location;
		this.detail = detail;
	}

	public Reason getReason() {
		return reason;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public String getDetail() {
		return detail;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
