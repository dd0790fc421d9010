package tacheck.trans.passes.typecheck;

import tacheck.TypeCheckerOptions;
import tacheck.errors.TopLevelIssueContext;
import tacheck.model.expr.Expression;
import tacheck.model.system.TimedAutomataSystem;

import java.util.logging.Logger;

public class TypeCheckingPass {
	private TypeCheckingPass() {}

	private static final Logger logger = Logger.getLogger("TypeCheckingPass");

	/**
	 * Type checks the whole system. Issues are reported to the system's issue context.
	 *
	 * @return whether no errors were found; warnings do not count
	 */
	public static boolean perform(TimedAutomataSystem system, TypeCheckerOptions options) {
		TopLevelIssueContext issues = system.getIssues();
		int errorsBefore = issues.getIssues().size();
		int warningsBefore = issues.getWarnings().size();
		logger.info("type checking " + system.getTemplates().size() + " templates and " +
				system.getQueries().size() + " queries");

		system.accept(new TypeChecker(system, options));

		int errors = issues.getIssues().size() - errorsBefore;
		int warnings = issues.getWarnings().size() - warningsBefore;
		logger.info("type checking finished with " + errors + " errors and " + warnings + " warnings");
		return errors == 0;
	}

	/**
	 * Checks an expression that is not part of the system, such as a query parsed on its own,
	 * against the declarations of an already checked system.
	 */
	public static boolean checkExpression(TimedAutomataSystem system, Expression expr) {
		return new TypeChecker(system, new TypeCheckerOptions()).checkExpression(expr);
	}

}
