package tacheck.trans.passes.typecheck;

import tacheck.TypeCheckerOptions;
import tacheck.model.expr.Expression;
import tacheck.model.expr.ExpressionKind;
import tacheck.model.expr.Synchronisation;
import tacheck.model.system.*;
import tacheck.model.type.Type;
import tacheck.model.type.TypeKind;
import tacheck.scope.Frame;
import tacheck.scope.Symbol;
import tacheck.trans.passes.effects.CollectChangesVisitor;
import tacheck.trans.passes.effects.CollectDependenciesVisitor;
import tacheck.trans.passes.effects.CollectDynamicExpressionsVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static tacheck.trans.passes.typecheck.TypePredicates.*;

/**
 * Type checks a whole system. Hand an instance to {@link TimedAutomataSystem#accept(SystemVisitor)};
 * every issue found is reported to the system's issue context, and facts that later stages need
 * (stopwatches, strict bounds, the synchronisation style) are recorded on the system.
 *
 * An instance performs exactly one pass over one system.
 */
public class TypeChecker extends SystemVisitor {

	private final TimedAutomataSystem system;
	private final TypeCheckerOptions options;
	private final CompileTimeComputableValues computable = new CompileTimeComputableValues();
	private final ExpressionTypeChecker checker;

	private SyncUsage syncUsed = SyncUsage.UNUSED;
	// set once the first mix of IO and CSP synchronisation has been reported
	private boolean syncError = false;

	public TypeChecker(TimedAutomataSystem system, TypeCheckerOptions options) {
		this.system = system;
		this.options = options;
		system.accept(computable);
		this.checker = new ExpressionTypeChecker(system, computable, system.getIssueContext());
		checker.checkExpression(system.getBeforeUpdate());
		checker.checkExpression(system.getAfterUpdate());
	}

	/**
	 * Checks a single expression, e.g. a query parsed after the system has been checked.
	 */
	public boolean checkExpression(Expression expr) {
		return checker.checkExpression(expr);
	}

	private void error(TypeCheckingIssue.Reason reason, Expression where) {
		checker.error(reason, where);
	}

	private void warning(TypeCheckingWarning.Reason reason, Expression where) {
		checker.warning(reason, where);
	}

	@Override
	public boolean visitTemplateBefore(Template template) {
		checker.setTemplate(template);
		checker.setIssueContext(system.getIssueContext().withContext(new WhileCheckingTemplate(template)));
		return true;
	}

	@Override
	public void visitTemplateAfter(Template template) {
		checker.setTemplate(null);
		checker.setIssueContext(system.getIssueContext());
	}

	/**
	 * Channel priorities name channels or elements of channel arrays; the indices must be
	 * known at compile time.
	 */
	@Override
	public void visitSystemAfter(TimedAutomataSystem system) {
		for (ChanPriority priority : system.getChanPriorities()) {
			checkChannelReference(priority.getHead());
			for (Expression entry : priority.getTail()) {
				checkChannelReference(entry);
			}
		}
	}

	// null is the default priority
	private void checkChannelReference(Expression expr) {
		if (expr == null || !checker.checkExpression(expr)) {
			return;
		}
		Type channel = expr.getType();
		while (channel.isArray()) {
			channel = channel.getSub();
		}
		if (!channel.isChannel()) {
			error(TypeCheckingIssue.Reason.CHANNEL_EXPECTED, expr);
		}
		checkChannelIndices(expr, expr, null);
	}

	private void checkChannelIndices(Expression whole, Expression expr, Frame extra) {
		while (expr.getKind() == ExpressionKind.ARRAY) {
			Expression index = expr.get(1);
			if (!checker.isCompileTimeComputable(index, extra)) {
				error(TypeCheckingIssue.Reason.MUST_BE_COMPUTABLE_AT_COMPILE_TIME, index);
			} else if (whole.changesAnyVariable()) {
				error(TypeCheckingIssue.Reason.INDEX_MUST_BE_SIDE_EFFECT_FREE, index);
			}
			expr = expr.get(0);
		}
	}

	@Override
	public void visitHybridClock(Expression clock) {
		if (checker.checkExpression(clock)) {
			if (!isClock(clock)) {
				error(TypeCheckingIssue.Reason.CLOCK_EXPECTED, clock);
			} else if (clock.changesAnyVariable()) {
				error(TypeCheckingIssue.Reason.INDEX_MUST_BE_SIDE_EFFECT_FREE, clock);
			}
		}
	}

	@Override
	public void visitIODecl(IODecl ioDecl) {
		for (Expression param : ioDecl.getParam()) {
			if (checker.checkExpression(param)) {
				if (!isInteger(param)) {
					error(TypeCheckingIssue.Reason.INTEGER_EXPECTED, param);
				} else if (!checker.isCompileTimeComputable(param)) {
					error(TypeCheckingIssue.Reason.MUST_BE_COMPUTABLE_AT_COMPILE_TIME, param);
				} else if (param.changesAnyVariable()) {
					error(TypeCheckingIssue.Reason.INDEX_MUST_BE_SIDE_EFFECT_FREE, param);
				}
			}
		}

		boolean io = !ioDecl.getInputs().isEmpty() || !ioDecl.getOutputs().isEmpty();
		boolean csp = !ioDecl.getCsp().isEmpty();
		if (syncUsed == SyncUsage.UNUSED) {
			if (io) {
				syncUsed = SyncUsage.IO;
			} else if (csp) {
				syncUsed = SyncUsage.CSP;
			}
		}
		boolean conflict = (syncUsed == SyncUsage.IO && csp) || (syncUsed == SyncUsage.CSP && io);
		if (conflict && !syncError) {
			syncError = true;
			Expression at = csp ? ioDecl.getCsp().get(0) :
					!ioDecl.getInputs().isEmpty() ? ioDecl.getInputs().get(0) : ioDecl.getOutputs().get(0);
			error(TypeCheckingIssue.Reason.CSP_AND_IO_MIXED, at);
		}
		system.setSyncUsed(syncUsed);

		for (Expression input : ioDecl.getInputs()) {
			checkChannelReference(input);
		}
		for (Expression output : ioDecl.getOutputs()) {
			checkChannelReference(output);
		}
	}

	/**
	 * Free parameters of processes span the process instances of the system, so they must
	 * range over a finite set and must not influence array sizes.
	 */
	@Override
	public void visitProcess(Instance process) {
		for (int i = 0; i < process.getUnbound(); ++i) {
			Symbol parameter = process.getParameters().get(i);
			Type type = parameter.getType();
			if (!(type.isScalar() || type.isRange()) || type.is(TypeKind.REF)) {
				checker.error(TypeCheckingIssue.Reason.FREE_PARAMETER_NOT_BOUNDED, type, parameter.getName());
			}
			if (process.getRestricted().contains(parameter)) {
				checker.error(TypeCheckingIssue.Reason.FREE_PARAMETER_RESTRICTED, type, parameter.getName());
			}
		}
	}

	@Override
	public void visitVariable(Variable variable) {
		Type type = variable.getUid().getType();
		checker.checkType(type);
		Expression init = variable.getInit();
		if (init == null) {
			return;
		}
		if (init.isDynamic() || init.hasDynamicSub()) {
			error(TypeCheckingIssue.Reason.DYNAMIC_INITIALISER, init);
		} else if (checker.checkExpression(init)) {
			if (!checker.isCompileTimeComputable(init)) {
				error(TypeCheckingIssue.Reason.MUST_BE_COMPUTABLE_AT_COMPILE_TIME, init);
			} else if (init.changesAnyVariable()) {
				error(TypeCheckingIssue.Reason.INITIALISER_MUST_BE_SIDE_EFFECT_FREE, init);
			} else {
				variable.setInit(checker.checkInitialiser(type, init));
			}
		}
	}

	@Override
	public void visitState(State state) {
		Expression invariant = state.getInvariant();
		if (invariant != null && checker.checkExpression(invariant)) {
			if (!isInvariantWR(invariant)) {
				checker.error(TypeCheckingIssue.Reason.NOT_AN_INVARIANT, invariant, invariant.getType().toString());
			} else if (invariant.changesAnyVariable()) {
				error(TypeCheckingIssue.Reason.INVARIANT_MUST_BE_SIDE_EFFECT_FREE, invariant);
			} else {
				RateDecomposer decomposer = new RateDecomposer();
				decomposer.decompose(invariant);
				state.setInvariant(decomposer.getInvariant());
				state.setCostRate(decomposer.getCostRate());
				if (decomposer.getCountCostRates() > 1) {
					error(TypeCheckingIssue.Reason.ONLY_ONE_COST_RATE, invariant);
				}
				if (decomposer.hasClockRates()) {
					system.recordStopWatch();
				}
				if (decomposer.hasStrictInvariant()) {
					system.recordStrictInvariant();
					if (options.strictInvariantWarnings) {
						warning(TypeCheckingWarning.Reason.STRICT_INVARIANT, invariant);
					}
				}
			}
		}
		Expression rate = state.getExponentialRate();
		if (rate != null && checker.checkExpression(rate)) {
			if (!isIntegral(rate) && rate.getKind() != ExpressionKind.FRACTION && !isDouble(rate)) {
				error(TypeCheckingIssue.Reason.NUMBER_EXPECTED, rate);
			}
		}
	}

	@Override
	public void visitEdge(Edge edge) {
		for (Symbol symbol : edge.getSelect().getSymbols()) {
			checker.checkType(symbol.getType());
		}

		Expression guard = edge.getGuard();
		boolean strictBound = false;
		if (guard != null && checker.checkExpression(guard)) {
			if (!isGuard(guard)) {
				checker.error(TypeCheckingIssue.Reason.NOT_A_GUARD, guard, guard.getType().toString());
			} else if (guard.changesAnyVariable()) {
				error(TypeCheckingIssue.Reason.GUARD_MUST_BE_SIDE_EFFECT_FREE, guard);
			}
			if (hasStrictLowerBound(guard)) {
				if (edge.isControllable()) {
					system.recordStrictLowerBoundOnControllableEdges();
				}
				strictBound = true;
			}
			if (hasStrictUpperBound(guard)) {
				strictBound = true;
			}
			if (strictBound) {
				system.recordStrictBound();
			}
		}

		Expression sync = edge.getSync();
		if (sync != null && checker.checkExpression(sync)) {
			checkEdgeSync(edge, guard, sync, strictBound);
		}

		checker.checkAssignmentExpression(edge.getAssign());
	}

	private void checkEdgeSync(Edge edge, Expression guard, Expression sync, boolean strictBound) {
		Type channel = sync.get(0).getType();
		if (!channel.isChannel()) {
			error(TypeCheckingIssue.Reason.CHANNEL_EXPECTED, sync.get(0));
		} else if (sync.changesAnyVariable()) {
			error(TypeCheckingIssue.Reason.SYNCHRONISATION_MUST_BE_SIDE_EFFECT_FREE, sync);
		} else {
			checkChannelIndices(sync.get(0), sync.get(0), edge.getSelect());

			boolean hasClockGuard = guard != null && !isIntegral(guard);
			boolean isUrgent = channel.is(TypeKind.URGENT);
			boolean receivesBroadcast = channel.is(TypeKind.BROADCAST) && sync.getSync() == Synchronisation.QUE;

			if (isUrgent && hasClockGuard) {
				system.setUrgentTransition();
				warning(TypeCheckingWarning.Reason.CLOCK_GUARD_ON_URGENT_EDGE, sync);
			} else if (receivesBroadcast && hasClockGuard) {
				system.clockGuardRecvBroadcast();
				warning(TypeCheckingWarning.Reason.EXPENSIVE_BROADCAST_GUARD, sync);
			}
			if (receivesBroadcast && (guard == null || guard.isTrue())) {
				// the target is absent for edges into branch points
				if (edge.getDst() == null) {
					warning(TypeCheckingWarning.Reason.NONDETERMINISTIC_BROADCAST_INPUT, sync);
				} else if (options.targetInvariantWarnings) {
					Expression target = edge.getDst().getInvariant();
					if (target != null && !target.isTrue()) {
						warning(TypeCheckingWarning.Reason.TARGET_INVARIANT_GUARD_NEEDED, sync);
					}
				}
			}
			if (isUrgent && strictBound) {
				warning(TypeCheckingWarning.Reason.STRICT_BOUND_ON_URGENT_EDGE, guard);
			}
		}

		updateSyncUsage(sync);

		if (options.refinementWarnings) {
			switch (sync.getSync()) {
				case BANG:
					if (edge.isControllable()) {
						warning(TypeCheckingWarning.Reason.OUTPUT_SHOULD_BE_UNCONTROLLABLE, sync);
					}
					break;
				case QUE:
					if (!edge.isControllable()) {
						warning(TypeCheckingWarning.Reason.INPUT_SHOULD_BE_CONTROLLABLE, sync);
					}
					break;
				default:
					warning(TypeCheckingWarning.Reason.CSP_INCOMPATIBLE_WITH_REFINEMENT, sync);
			}
		}
	}

	/**
	 * A model synchronises either through IO channels (! and ?) or CSP style, never both. The
	 * first synchronisation decides; the first one of the other style is reported.
	 */
	private void updateSyncUsage(Expression sync) {
		boolean csp = sync.getSync() == Synchronisation.CSP;
		switch (syncUsed) {
			case UNUSED:
				syncUsed = csp ? SyncUsage.CSP : SyncUsage.IO;
				break;
			case IO:
				if (csp && !syncError) {
					syncError = true;
					error(TypeCheckingIssue.Reason.ASSUMED_IO_FOUND_CSP, sync);
				}
				break;
			case CSP:
				if (!csp && !syncError) {
					syncError = true;
					error(TypeCheckingIssue.Reason.ASSUMED_CSP_FOUND_IO, sync);
				}
				break;
		}
		system.setSyncUsed(syncUsed);
	}

	@Override
	public void visitMessage(Message message) {
		Expression label = message.getLabel();
		if (label != null && checker.checkExpression(label)) {
			if (!label.get(0).getType().isChannel()) {
				error(TypeCheckingIssue.Reason.CHANNEL_EXPECTED, label.get(0));
			} else if (label.changesAnyVariable()) {
				error(TypeCheckingIssue.Reason.MESSAGE_MUST_BE_SIDE_EFFECT_FREE, label);
			}
		}
	}

	@Override
	public void visitCondition(Condition condition) {
		Expression label = condition.getLabel();
		if (label != null && checker.checkExpression(label)) {
			if (!isGuard(label)) {
				checker.error(TypeCheckingIssue.Reason.NOT_A_CONDITION, label, label.getType().toString());
			} else if (label.changesAnyVariable()) {
				error(TypeCheckingIssue.Reason.CONDITION_MUST_BE_SIDE_EFFECT_FREE, label);
			}
		}
	}

	@Override
	public void visitUpdate(Update update) {
		checker.checkAssignmentExpression(update.getLabel());
	}

	@Override
	public void visitProgressMeasure(Progress progress) {
		Expression guard = progress.getGuard();
		Expression measure = progress.getMeasure();
		boolean guardOk = checker.checkExpression(guard);
		boolean measureOk = checker.checkExpression(measure);
		if (guard != null && guardOk && !isIntegral(guard)) {
			error(TypeCheckingIssue.Reason.PROGRESS_GUARD_NOT_BOOLEAN, guard);
		}
		if (measureOk && !isIntegral(measure)) {
			error(TypeCheckingIssue.Reason.PROGRESS_MEASURE_NOT_VALUE, measure);
		}
	}

	@Override
	public void visitGanttChart(GanttChart ganttChart) {
		for (Symbol parameter : ganttChart.getParameters().getSymbols()) {
			checker.checkType(parameter.getType());
		}
		for (GanttMap map : ganttChart.getMapping()) {
			for (Symbol parameter : map.getParameters().getSymbols()) {
				checker.checkType(parameter.getType());
			}
			Expression predicate = map.getPredicate();
			if (checker.checkExpression(predicate) && !isIntegral(predicate) && !isConstraint(predicate)) {
				error(TypeCheckingIssue.Reason.BOOLEAN_EXPECTED, predicate);
			}
			Expression mapping = map.getMapping();
			if (checker.checkExpression(mapping) && !isIntegral(mapping)) {
				error(TypeCheckingIssue.Reason.INTEGER_EXPECTED, mapping);
			}
		}
	}

	/**
	 * Arguments of instantiations are evaluated once, when the system is built. A value
	 * parameter or constant reference needs a computable argument, a reference parameter a
	 * unique reference.
	 */
	@Override
	public void visitInstance(Instance instance) {
		Type type = instance.getUid().getType();
		for (int i = 0; i < type.size(); ++i) {
			checker.checkType(type.get(i));
		}

		Frame parameters = instance.getParameters();
		for (int i = type.size(); i < type.size() + instance.getArguments(); ++i) {
			Symbol parameter = parameters.get(i);
			Expression argument = instance.getMapping().get(parameter);
			if (!checker.checkExpression(argument)) {
				continue;
			}
			if (argument.changesAnyVariable()) {
				error(TypeCheckingIssue.Reason.ARGUMENT_MUST_BE_SIDE_EFFECT_FREE, argument);
				continue;
			}
			boolean ref = parameter.getType().is(TypeKind.REF);
			boolean constant = parameter.getType().isConstant();
			boolean argumentComputable = checker.isCompileTimeComputable(argument);
			if ((!ref && !argumentComputable) ||
					(ref && !constant && !checker.isUniqueReference(argument)) ||
					(ref && constant && !argumentComputable)) {
				checker.error(TypeCheckingIssue.Reason.INCOMPATIBLE_ARGUMENT, argument, parameter.getName());
				continue;
			}
			checker.checkParameterCompatible(parameter.getType(), argument);
		}
	}

	@Override
	public void visitFunction(Function function) {
		Type returnType = function.getReturnType();
		checker.checkType(returnType);
		if (!returnType.isVoid() && !isValidReturnType(returnType)) {
			checker.error(TypeCheckingIssue.Reason.INVALID_RETURN_TYPE, returnType, returnType.toString());
		}

		function.getBody().accept(new StatementTypeCheckingVisitor(checker, function));

		List<Expression> dynamic = new ArrayList<>();
		function.getBody().accept(new CollectDynamicExpressionsVisitor(dynamic));
		for (Expression expr : dynamic) {
			error(TypeCheckingIssue.Reason.DYNAMIC_ONLY_ON_EDGES, expr);
		}

		// locals and parameters are not external effects of the function
		Set<Symbol> changes = function.getChanges();
		Set<Symbol> depends = function.getDepends();
		function.getBody().accept(new CollectChangesVisitor(changes));
		function.getBody().accept(new CollectDependenciesVisitor(depends));
		for (Variable variable : function.getVariables()) {
			changes.remove(variable.getUid());
			depends.remove(variable.getUid());
		}
		Frame frame = function.getBody().getFrame();
		for (int i = 0; i < function.getParameterCount(); ++i) {
			changes.remove(frame.get(i));
			depends.remove(frame.get(i));
		}
	}

	private static boolean isGameProperty(Expression expr) {
		switch (expr.getKind()) {
			case CONTROL:
			case SMC_CONTROL:
			case EF_CONTROL:
			case CONTROL_TOPT:
			case PO_CONTROL:
			case CONTROL_TOPT_DEF1:
			case CONTROL_TOPT_DEF2:
			case SIMULATION_LE:
			case SIMULATION_GE:
			case REFINEMENT_LE:
			case REFINEMENT_GE:
			case CONSISTENCY:
			case IMPLEMENTATION:
			case SPECIFICATION:
				return true;
			default:
				return false;
		}
	}

	// these take their sub-expressions as state predicates or monitored values, not formulas
	private static boolean allowsNestedFormulas(Expression expr) {
		switch (expr.getKind()) {
			case SUP_VAR:
			case INF_VAR:
			case SCENARIO:
			case PROBAMINBOX:
			case PROBAMINDIAMOND:
			case PROBABOX:
			case PROBADIAMOND:
			case PROBAEXP:
			case PROBACMP:
			case SIMULATE:
			case SIMULATEREACH:
			case MITLFORMULA:
				return true;
			default:
				return false;
		}
	}

	private static boolean hasMITLInQuantifiedSub(Expression expr) {
		if (expr.getKind() == ExpressionKind.MITLFORALL || expr.getKind() == ExpressionKind.MITLEXISTS) {
			return true;
		}
		for (Expression child : expr.getChildren()) {
			if (hasMITLInQuantifiedSub(child)) {
				return true;
			}
		}
		return false;
	}

	@Override
	public void visitProperty(Expression property) {
		if (!checker.checkExpression(property)) {
			return;
		}
		if (property.changesAnyVariable()) {
			error(TypeCheckingIssue.Reason.PROPERTY_MUST_BE_SIDE_EFFECT_FREE, property);
		}
		boolean consistency = property.getType().is(TypeKind.TIOGRAPH) &&
				property.getKind() == ExpressionKind.CONSISTENCY;
		if (!consistency && !isFormula(property)) {
			error(TypeCheckingIssue.Reason.PROPERTY_MUST_BE_VALID_FORMULA, property);
		}
		if (!isGameProperty(property) && !allowsNestedFormulas(property)) {
			// only constraints may be nested in path formulas
			for (Expression sub : property.getChildren()) {
				if (!isConstraint(sub)) {
					error(TypeCheckingIssue.Reason.NESTED_PATH_QUANTIFIERS, sub);
				}
			}
		}
		if (property.getKind() == ExpressionKind.PO_CONTROL) {
			checkObservationConstraints(property);
		}
		if (property.getKind() != ExpressionKind.MITLFORMULA && hasMITLInQuantifiedSub(property)) {
			error(TypeCheckingIssue.Reason.MITL_IN_QUANTIFIED_SUB, property);
		}
	}

	/**
	 * Observations of partially observable controllers may only bound clocks weakly from below
	 * and strictly from above, and may not compare clocks with each other.
	 */
	private void checkObservationConstraints(Expression expr) {
		for (Expression child : expr.getChildren()) {
			checkObservationConstraints(child);
		}

		boolean invalid;
		switch (expr.getKind()) {
			case LT: // int < clock
			case GE: // int >= clock
				invalid = isIntegral(expr.get(0)) && isClock(expr.get(1));
				break;
			case LE: // clock <= int
			case GT: // clock > int
				invalid = isClock(expr.get(0)) && isIntegral(expr.get(1));
				break;
			case EQ:
			case NEQ:
				invalid = (isClock(expr.get(0)) && isIntegral(expr.get(1))) ||
						(isIntegral(expr.get(0)) && isClock(expr.get(1)));
				break;
			default:
				return;
		}

		if (invalid) {
			error(TypeCheckingIssue.Reason.CLOCK_BOUNDS_NOT_WEAK_LOWER_STRICT_UPPER, expr);
		} else if ((isClock(expr.get(0)) && isClock(expr.get(1))) ||
				(isDiff(expr.get(0)) && isInteger(expr.get(1))) ||
				(isInteger(expr.get(0)) && isDiff(expr.get(1)))) {
			error(TypeCheckingIssue.Reason.CLOCK_DIFFERENCES_NOT_SUPPORTED, expr);
		}
	}

}
