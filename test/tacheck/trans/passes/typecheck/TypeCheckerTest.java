package tacheck.trans.passes.typecheck;

import org.junit.Before;
import org.junit.Test;
import tacheck.TypeCheckerOptions;
import tacheck.errors.Issue;
import tacheck.errors.IssueWithContext;
import tacheck.model.expr.Expression;
import tacheck.model.expr.ExpressionKind;
import tacheck.model.expr.Synchronisation;
import tacheck.model.stmt.BlockStatement;
import tacheck.model.system.*;
import tacheck.model.type.Type;
import tacheck.scope.Frame;
import tacheck.scope.Symbol;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.junit.Assert.*;
import static tacheck.model.expr.ExpressionBuilder.*;
import static tacheck.model.stmt.StatementBuilder.*;
import static tacheck.model.type.TypeBuilder.*;

public class TypeCheckerTest {

	private TimedAutomataSystem system;
	private TypeCheckerOptions options;
	private Declarations globals;

	private Symbol x;
	private Symbol c;
	private Symbol cost;
	private Symbol a;
	private Symbol b;
	private Symbol u;
	private Symbol bc;

	@Before
	public void setup() {
		system = new TimedAutomataSystem();
		options = new TypeCheckerOptions();
		globals = system.getGlobals();
		x = globals.addVariable("x", intType(), null).getUid();
		c = globals.addVariable("c", clockType(), null).getUid();
		cost = globals.addVariable("cost", costType(), null).getUid();
		a = globals.addVariable("a", chanType(), null).getUid();
		b = globals.addVariable("b", chanType(), null).getUid();
		u = globals.addVariable("u", urgent(chanType()), null).getUid();
		bc = globals.addVariable("bc", broadcast(chanType()), null).getUid();
	}

	private void check() {
		system.accept(new TypeChecker(system, options));
	}

	private List<TypeCheckingIssue.Reason> errors() {
		List<TypeCheckingIssue.Reason> reasons = new ArrayList<>();
		for (Issue issue : system.getIssues().getIssues()) {
			reasons.add(((TypeCheckingIssue) issue.unwrap()).getReason());
		}
		return reasons;
	}

	private List<TypeCheckingWarning.Reason> warnings() {
		List<TypeCheckingWarning.Reason> reasons = new ArrayList<>();
		for (Issue issue : system.getIssues().getWarnings()) {
			reasons.add(((TypeCheckingWarning) issue.unwrap()).getReason());
		}
		return reasons;
	}

	private Template template(String name) {
		return system.addTemplate(name, system.newParameterFrame());
	}

	// a! in one edge, then a CSP style b twice: only the first CSP edge is reported
	@Test
	public void ioThenCsp() {
		Template p = template("P");
		State s0 = p.addState("s0", null);
		p.addEdge(s0, s0, true).setSync(sync(id(a), Synchronisation.BANG));
		Expression first = sync(id(b), Synchronisation.CSP);
		p.addEdge(s0, s0, true).setSync(first);
		p.addEdge(s0, s0, true).setSync(sync(id(b), Synchronisation.CSP));
		check();
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.ASSUMED_IO_FOUND_CSP), errors());
		Issue issue = system.getIssues().getIssues().get(0);
		assertThat(issue, instanceOf(IssueWithContext.class));
		assertSame(first.getLocation(), ((TypeCheckingIssue) issue.unwrap()).getLocation());
		assertEquals(SyncUsage.IO, system.getSyncUsed());
	}

	@Test
	public void cspThenIo() {
		Template p = template("P");
		State s0 = p.addState("s0", null);
		p.addEdge(s0, s0, true).setSync(sync(id(b), Synchronisation.CSP));
		p.addEdge(s0, s0, true).setSync(sync(id(a), Synchronisation.QUE));
		p.addEdge(s0, s0, true).setSync(sync(id(a), Synchronisation.BANG));
		check();
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.ASSUMED_CSP_FOUND_IO), errors());
		assertEquals(SyncUsage.CSP, system.getSyncUsed());
	}

	// a conflict found in an IO declaration is not reported again for the edges
	@Test
	public void ioDeclarationConflict() {
		globals.addIODecl(new IODecl("P", Collections.emptyList(), Collections.singletonList(id(a)),
				Collections.emptyList(), Collections.singletonList(id(b))));
		Template p = template("P");
		State s0 = p.addState("s0", null);
		p.addEdge(s0, s0, true).setSync(sync(id(b), Synchronisation.CSP));
		check();
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.CSP_AND_IO_MIXED), errors());
	}

	// c <= 10 && cost' == 2
	@Test
	public void stateWithCostRate() {
		Template p = template("P");
		Expression bound = le(id(c), num(10));
		Expression two = num(2);
		State s0 = p.addState("s0", and(bound, eq(rate(id(cost)), two)));
		check();
		assertFalse(system.hasErrors());
		assertSame(bound, s0.getInvariant());
		assertSame(two, s0.getCostRate());
		assertFalse(system.hasStopWatch());
		assertFalse(system.hasStrictInvariants());
	}

	@Test
	public void stopWatch() {
		Template p = template("P");
		p.addState("s0", eq(rate(id(c)), num(0)));
		check();
		assertFalse(system.hasErrors());
		assertTrue(system.hasStopWatch());
	}

	@Test
	public void twoCostRates() {
		Template p = template("P");
		p.addState("s0", and(eq(rate(id(cost)), num(1)), eq(rate(id(cost)), num(2))));
		check();
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.ONLY_ONE_COST_RATE), errors());
	}

	// strict invariants are recorded, and only reported when asked for
	@Test
	public void strictInvariant() {
		Template p = template("P");
		p.addState("s0", lt(id(c), num(5)));
		check();
		assertTrue(system.hasStrictInvariants());
		assertFalse(system.hasWarnings());
	}

	@Test
	public void strictInvariantWarning() {
		options.withStrictInvariantWarnings(true);
		Template p = template("P");
		p.addState("s0", lt(id(c), num(5)));
		check();
		assertEquals(Collections.singletonList(TypeCheckingWarning.Reason.STRICT_INVARIANT), warnings());
	}

	// c > 5 is a strict lower bound, which does not make the invariant strict
	@Test
	public void strictLowerBoundInvariant() {
		options.withStrictInvariantWarnings(true);
		Template p = template("P");
		p.addState("s0", gt(id(c), num(5)));
		check();
		assertFalse(system.hasErrors());
		assertFalse(system.hasStrictInvariants());
		assertFalse(system.hasWarnings());
	}

	@Test
	public void notAnInvariant() {
		Template p = template("P");
		p.addState("s0", eq(id(c), num(5)));
		check();
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.NOT_AN_INVARIANT), errors());
	}

	// c < 5 is a fine guard with a strict upper bound; c > 5 on a controllable edge is a strict lower bound
	@Test
	public void strictGuards() {
		Template p = template("P");
		State s0 = p.addState("s0", null);
		p.addEdge(s0, s0, true).setGuard(lt(id(c), num(5)));
		check();
		assertFalse(system.hasErrors());
		assertTrue(system.hasStrictBound());
		assertFalse(system.hasStrictLowerBoundOnControllableEdges());
	}

	@Test
	public void strictLowerBoundOnControllableEdge() {
		Template p = template("P");
		State s0 = p.addState("s0", null);
		p.addEdge(s0, s0, true).setGuard(gt(id(c), num(5)));
		check();
		assertTrue(system.hasStrictLowerBoundOnControllableEdges());
	}

	@Test
	public void rateIsNotAGuard() {
		Template p = template("P");
		State s0 = p.addState("s0", null);
		p.addEdge(s0, s0, true).setGuard(eq(rate(id(cost)), num(2)));
		check();
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.NOT_A_GUARD), errors());
	}

	@Test
	public void clockGuardOnUrgentChannel() {
		Template p = template("P");
		State s0 = p.addState("s0", null);
		p.addEdge(s0, s0, true).setGuard(ge(id(c), num(2))).setSync(sync(id(u), Synchronisation.BANG));
		check();
		assertFalse(system.hasErrors());
		assertTrue(system.hasUrgentTransition());
		assertEquals(Collections.singletonList(TypeCheckingWarning.Reason.CLOCK_GUARD_ON_URGENT_EDGE), warnings());
	}

	// receiving a broadcast into a branch point without a guard
	@Test
	public void broadcastIntoBranchPoint() {
		Template p = template("P");
		State s0 = p.addState("s0", null);
		p.addEdge(s0, null, true).setSync(sync(id(bc), Synchronisation.QUE));
		check();
		assertEquals(Collections.singletonList(TypeCheckingWarning.Reason.NONDETERMINISTIC_BROADCAST_INPUT),
				warnings());
	}

	@Test
	public void refinementWarnings() {
		options.withRefinementWarnings(true);
		Template p = template("P");
		State s0 = p.addState("s0", null);
		p.addEdge(s0, s0, true).setSync(sync(id(a), Synchronisation.BANG));
		p.addEdge(s0, s0, false).setSync(sync(id(a), Synchronisation.QUE));
		check();
		assertEquals(Arrays.asList(
				TypeCheckingWarning.Reason.OUTPUT_SHOULD_BE_UNCONTROLLABLE,
				TypeCheckingWarning.Reason.INPUT_SHOULD_BE_CONTROLLABLE), warnings());
	}

	@Test
	public void exitInDynamicTemplate() {
		Template dynamic = system.addDynamicTemplate("D", system.newParameterFrame(), true);
		State s0 = dynamic.addState("s0", null);
		dynamic.addEdge(s0, s0, true).setAssign(exit());
		Template p = template("P");
		State s1 = p.addState("s1", null);
		p.addEdge(s1, s1, true).setAssign(exit());
		check();
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.EXIT_IN_NON_DYNAMIC_TEMPLATE), errors());
	}

	// int f(int p) { int l = 1; x = p + l; return x; }
	@Test
	public void functionEffects() {
		Frame frame = new Frame(globals.getFrame());
		Symbol p = frame.add("p", intType());
		Variable l = Variable.declare(frame, "l", intType(), num(1));
		BlockStatement body = block(frame,
				expr(assign(id(x), plus(id(p), id(l.getUid())))),
				returnStatement(id(x)));
		Function f = globals.addFunction("f", function(intType(), intType()), body, Collections.singletonList(l));
		check();
		assertFalse(system.hasErrors());
		assertEquals(new HashSet<>(Collections.singletonList(x)), f.getChanges());
		assertEquals(new HashSet<>(Collections.singletonList(x)), f.getDepends());
	}

	// returning a clock from an int function
	@Test
	public void incompatibleReturnValue() {
		Frame frame = new Frame(globals.getFrame());
		globals.addFunction("f", function(intType()), block(frame, returnStatement(id(c))),
				Collections.emptyList());
		check();
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.INCOMPATIBLE_ARGUMENT), errors());
	}

	@Test
	public void dynamicConstructInFunction() {
		Template dynamic = system.addDynamicTemplate("D", system.newParameterFrame(), true);
		Frame frame = new Frame(globals.getFrame());
		globals.addFunction("f", function(voidType()), block(frame, expr(numOf(dynamic.getUid()))),
				Collections.emptyList());
		check();
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.DYNAMIC_ONLY_ON_EDGES), errors());
	}

	// T(const int n) instantiated with a variable
	@Test
	public void instanceArgumentsMustBeComputable() {
		Frame parameters = system.newParameterFrame();
		parameters.add("n", constant(intType()));
		Template t = system.addTemplate("T", parameters);
		t.addState("s0", null);
		system.addInstance("Good", t, new Frame(), Collections.singletonList(num(3)));
		system.addInstance("Bad", t, new Frame(), Collections.singletonList(id(x)));
		check();
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.INCOMPATIBLE_ARGUMENT), errors());
	}

	@Test
	public void initialiserMustBeComputable() {
		globals.addVariable("y", intType(), plus(id(x), num(1)));
		globals.addVariable("z", constant(intType()), num(2));
		check();
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.MUST_BE_COMPUTABLE_AT_COMPILE_TIME), errors());
	}

	@Test
	public void properties() {
		system.addQuery(gt(id(x), num(1)));
		system.addQuery(assign(id(x), num(1)));
		check();
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.PROPERTY_MUST_BE_SIDE_EFFECT_FREE), errors());
	}

	// void f() { for (i : T) x = 1; }
	private void iterateOver(Type type) {
		Frame frame = new Frame(globals.getFrame());
		Frame loop = new Frame(frame);
		Symbol i = loop.add("i", type);
		globals.addFunction("f", function(voidType()),
				block(frame, iteration(i, loop, expr(assign(id(x), num(1))))), Collections.emptyList());
		check();
	}

	@Test
	public void iterationOverRange() {
		iterateOver(range(0, 3));
		assertFalse(system.hasErrors());
	}

	@Test
	public void iterationOverScalarSet() {
		iterateOver(scalar("S", 3));
		assertFalse(system.hasErrors());
	}

	// a plain int has no bounds to iterate over
	@Test
	public void iterationOverUnboundedInteger() {
		iterateOver(intType());
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.RANGE_EXPECTED), errors());
	}

	@Test
	public void iterationOverBoolean() {
		iterateOver(boolType());
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.SCALAR_SET_OR_INTEGER_EXPECTED), errors());
	}

	// A[] c <= 10, and control: A[] E<> x > 1, which as a game may nest path formulas
	@Test
	public void pathFormulas() {
		system.addQuery(unary(ExpressionKind.AG, le(id(c), num(10))));
		system.addQuery(unary(ExpressionKind.CONTROL, unary(ExpressionKind.AG,
				unary(ExpressionKind.EF, gt(id(x), num(1))))));
		check();
		assertFalse(system.hasErrors());
	}

	// A[] E<> x > 1
	@Test
	public void nestedPathQuantifiers() {
		system.addQuery(unary(ExpressionKind.AG, unary(ExpressionKind.EF, gt(id(x), num(1)))));
		check();
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.NESTED_PATH_QUANTIFIERS), errors());
	}

	// observations bound clocks weakly from below and strictly from above
	@Test
	public void partialObservationControl() {
		system.addQuery(binary(ExpressionKind.PO_CONTROL,
				list(ge(id(c), num(2)), lt(id(c), num(5))),
				unary(ExpressionKind.AG, gt(id(x), num(0)))));
		check();
		assertFalse(system.hasErrors());
	}

	@Test
	public void invalidObservations() {
		system.addQuery(binary(ExpressionKind.PO_CONTROL,
				list(gt(id(c), num(2)), lt(minus(id(c), id(c)), num(3))),
				unary(ExpressionKind.AG, gt(id(x), num(0)))));
		check();
		assertEquals(Arrays.asList(TypeCheckingIssue.Reason.CLOCK_BOUNDS_NOT_WEAK_LOWER_STRICT_UPPER,
				TypeCheckingIssue.Reason.CLOCK_DIFFERENCES_NOT_SUPPORTED), errors());
	}

	@Test
	public void quantifiedMitl() {
		system.addQuery(nary(ExpressionKind.MITLFORMULA, nary(ExpressionKind.MITLFORALL, gt(id(x), num(1)))));
		check();
		assertFalse(system.hasErrors());
	}

	// quantified MITL is only allowed inside an MITL property
	@Test
	public void quantifiedMitlOutsideMitlProperty() {
		system.addQuery(unary(ExpressionKind.CONTROL, nary(ExpressionKind.MITLFORALL, gt(id(x), num(1)))));
		check();
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.MITL_IN_QUANTIFIED_SUB), errors());
	}

}
