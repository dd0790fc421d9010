package tacheck.trans.passes.typecheck;

import org.junit.Before;
import org.junit.Test;
import tacheck.errors.Issue;
import tacheck.errors.TopLevelIssueContext;
import tacheck.model.expr.Expression;
import tacheck.model.expr.ExpressionKind;
import tacheck.model.system.Declarations;
import tacheck.model.system.Template;
import tacheck.model.system.TimedAutomataSystem;
import tacheck.model.type.Type;
import tacheck.model.type.TypeKind;
import tacheck.scope.Frame;
import tacheck.scope.Symbol;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.CoreMatchers.hasItem;
import static org.junit.Assert.*;
import static tacheck.model.expr.ExpressionBuilder.*;
import static tacheck.model.type.TypeBuilder.*;

public class ExpressionTypeCheckerTest {

	private TimedAutomataSystem system;
	private TopLevelIssueContext ctx;
	private ExpressionTypeChecker checker;

	private Symbol k;
	private Symbol x;
	private Symbol c;
	private Symbol cost;
	private Symbol ch;
	private Symbol u;
	private Symbol arr;
	private Type pair;

	@Before
	public void setup() {
		system = new TimedAutomataSystem();
		Declarations globals = system.getGlobals();
		k = globals.addVariable("k", constant(intType()), num(4)).getUid();
		x = globals.addVariable("x", intType(), null).getUid();
		c = globals.addVariable("c", clockType(), null).getUid();
		cost = globals.addVariable("cost", costType(), null).getUid();
		ch = globals.addVariable("ch", chanType(), null).getUid();
		u = globals.addVariable("u", urgent(chanType()), null).getUid();
		arr = globals.addVariable("arr", array(intType(), 3), null).getUid();
		pair = record(Arrays.asList("a", "b"), Arrays.asList(intType(), intType()));

		CompileTimeComputableValues computable = new CompileTimeComputableValues();
		system.accept(computable);
		ctx = new TopLevelIssueContext();
		checker = new ExpressionTypeChecker(system, computable, ctx);
	}

	private List<TypeCheckingIssue.Reason> reasons() {
		List<TypeCheckingIssue.Reason> reasons = new ArrayList<>();
		for (Issue issue : ctx.getIssues()) {
			reasons.add(((TypeCheckingIssue) issue.unwrap()).getReason());
		}
		return reasons;
	}

	private TypeKind check(Expression expr) {
		assertTrue(checker.checkExpression(expr));
		return expr.getType().getKind();
	}

	// const int x = 2 + 3;
	@Test
	public void constantInitialiser() {
		Expression init = plus(num(2), num(3));
		assertEquals(TypeKind.INT, check(init));
		assertTrue(checker.isCompileTimeComputable(init));
		assertSame(init, checker.checkInitialiser(constant(intType()), init));
		assertFalse(ctx.hasErrors());
	}

	// constants are computable, variables are not, and neither is anything reading a variable
	@Test
	public void computability() {
		assertTrue(checker.isCompileTimeComputable(id(k)));
		assertTrue(checker.isCompileTimeComputable(mult(id(k), num(2))));
		assertFalse(checker.isCompileTimeComputable(id(x)));
		assertFalse(checker.isCompileTimeComputable(plus(id(k), id(x))));
	}

	// checking an expression a second time yields the same type and no new issues
	@Test
	public void recheckIsStable() {
		Expression e = and(le(id(c), plus(id(k), num(1))), eq(rate(id(cost)), num(2)));
		assertTrue(checker.checkExpression(e));
		Type first = e.getType();
		assertTrue(checker.checkExpression(e));
		assertEquals(first, e.getType());
		assertFalse(ctx.hasErrors());
		assertFalse(ctx.hasWarnings());
	}

	@Test
	public void conditionLattice() {
		assertEquals(TypeKind.BOOL, check(gt(id(x), num(1))));
		assertEquals(TypeKind.INVARIANT, check(lt(id(c), num(5))));
		assertEquals(TypeKind.INVARIANT, check(and(le(id(c), num(10)), ge(id(c), num(2)))));
		assertEquals(TypeKind.INVARIANT_WR, check(and(le(id(c), num(10)), eq(rate(id(cost)), num(2)))));
		assertEquals(TypeKind.GUARD, check(eq(id(c), num(3))));
		assertEquals(TypeKind.CONSTRAINT, check(neq(id(c), num(3))));
		assertEquals(TypeKind.INVARIANT, check(or(gt(id(x), num(0)), le(id(c), num(4)))));
		assertFalse(ctx.hasErrors());
	}

	// clock - int stays a clock, int - clock does not
	@Test
	public void clockArithmetic() {
		assertEquals(TypeKind.CLOCK, check(minus(id(c), num(3))));
		assertEquals(TypeKind.CLOCK, check(plus(num(3), id(c))));
		assertEquals(TypeKind.DOUBLE, check(minus(num(3), id(c))));
		assertEquals(TypeKind.DIFF, check(minus(id(c), id(c))));
		assertEquals(TypeKind.DOUBLE, check(mult(id(c), real(1.5))));
	}

	@Test
	public void assignToConstant() {
		assertFalse(checker.checkExpression(assign(id(k), num(1))));
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.LEFT_HAND_SIDE_EXPECTED), reasons());
	}

	@Test
	public void incompatibleAssignment() {
		assertFalse(checker.checkExpression(assign(id(ch), num(1))));
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.INCOMPATIBLE_TYPES), reasons());
	}

	// one mistake deep inside an expression is reported once
	@Test
	public void failedChildIsNotReportedAgain() {
		Expression e = plus(mult(assign(id(k), num(1)), num(2)), num(3));
		assertFalse(checker.checkExpression(e));
		assertEquals(1, ctx.getIssues().size());
		assertTrue(e.getType().isUnknown());
	}

	@Test
	public void logicalOnChannelIsTypeError() {
		assertFalse(checker.checkExpression(and(id(ch), num(1))));
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.TYPE_ERROR), reasons());
	}

	// passing x + 1 for a ref int parameter
	@Test
	public void nonLValueForReference() {
		Expression argument = plus(id(x), num(1));
		check(argument);
		assertFalse(checker.isParameterCompatible(ref(intType()), argument));
		assertFalse(checker.checkParameterCompatible(ref(intType()), argument));
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.INCOMPATIBLE_ARGUMENT), reasons());
		assertTrue(checker.isParameterCompatible(ref(intType()), id(x)));
		assertTrue(checker.isParameterCompatible(constant(ref(intType())), argument));
	}

	// urgent channels can only be passed where urgent channels are expected
	@Test
	public void channelCapabilities() {
		assertFalse(checker.isParameterCompatible(chanType(), id(u)));
		assertTrue(checker.isParameterCompatible(urgent(chanType()), id(ch)));
		assertTrue(checker.isParameterCompatible(urgent(chanType()), id(u)));
		assertFalse(checker.isParameterCompatible(broadcast(chanType()), id(u)));
	}

	@Test
	public void uniqueReferences() {
		assertTrue(checker.isUniqueReference(index(id(arr), id(k))));
		assertFalse(checker.isUniqueReference(index(id(arr), id(x))));
		assertTrue(checker.isLValue(index(id(arr), id(x))));
		assertFalse(checker.isModifiableLValue(id(k)));
		assertFalse(checker.isLValue(num(1)));
	}

	// { b: 1, a: 2 } is reordered into { a: 2, b: 1 }
	@Test
	public void recordInitialiserIsReordered() {
		Expression init = list(Arrays.asList("b", "a"), Arrays.asList(num(1), num(2)));
		check(init);
		Expression result = checker.checkInitialiser(pair, init);
		assertFalse(ctx.hasErrors());
		assertEquals(ExpressionKind.LIST, result.getKind());
		assertEquals(2, result.getSize());
		assertSame(init.get(1), result.get(0));
		assertSame(init.get(0), result.get(1));
		assertSame(pair, result.getType());
	}

	// { 1, 2 } fills the fields in declaration order
	@Test
	public void positionalRecordInitialiser() {
		Expression init = list(num(1), num(2));
		check(init);
		Expression result = checker.checkInitialiser(pair, init);
		assertFalse(ctx.hasErrors());
		assertSame(init.get(0), result.get(0));
		assertSame(init.get(1), result.get(1));
	}

	@Test
	public void incompleteRecordInitialiser() {
		Expression init = list(Collections.singletonList("a"), Collections.singletonList(num(1)));
		check(init);
		assertSame(init, checker.checkInitialiser(pair, init));
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.INCOMPLETE_INITIALISER), reasons());
		assertEquals("b", ((TypeCheckingIssue) ctx.getIssues().get(0)).getDetail());
	}

	// { a: 1, a: 2, b: 3 } keeps the first value for a
	@Test
	public void duplicateRecordInitialiser() {
		Expression init = list(Arrays.asList("a", "a", "b"), Arrays.asList(num(1), num(2), num(3)));
		check(init);
		Expression result = checker.checkInitialiser(pair, init);
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.MULTIPLE_INITIALISERS), reasons());
		assertSame(init.get(0), result.get(0));
		assertSame(init.get(2), result.get(1));
	}

	// the walk stops at the first unknown field
	@Test
	public void unknownFieldInInitialiser() {
		Expression init = list(Arrays.asList("z", "y"), Arrays.asList(num(1), num(2)));
		check(init);
		assertSame(init, checker.checkInitialiser(pair, init));
		assertEquals(Arrays.asList(TypeCheckingIssue.Reason.UNKNOWN_FIELD,
				TypeCheckingIssue.Reason.INCOMPLETE_INITIALISER), reasons());
	}

	// { b: 2, a: 1, z: 3 } stops at z but keeps the fields already placed
	@Test
	public void unknownFieldAfterAllFields() {
		Expression one = num(1);
		Expression two = num(2);
		Expression init = list(Arrays.asList("b", "a", "z"), Arrays.asList(two, one, num(3)));
		check(init);
		Expression result = checker.checkInitialiser(pair, init);
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.UNKNOWN_FIELD), reasons());
		assertEquals(ExpressionKind.LIST, result.getKind());
		assertEquals(2, result.getSize());
		assertSame(one, result.get(0));
		assertSame(two, result.get(1));
	}

	@Test
	public void tooManyElements() {
		Expression one = num(1);
		Expression two = num(2);
		Expression init = list(one, two, num(3));
		check(init);
		Expression result = checker.checkInitialiser(pair, init);
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.TOO_MANY_ELEMENTS), reasons());
		assertEquals(2, result.getSize());
		assertSame(one, result.get(0));
		assertSame(two, result.get(1));
	}

	@Test
	public void arrayInitialiser() {
		Expression init = list(num(1), num(2), num(3));
		check(init);
		Expression result = checker.checkInitialiser(array(intType(), 3), init);
		assertFalse(ctx.hasErrors());
		assertEquals(3, result.getSize());

		Expression labelled = list(Arrays.asList("", "a"), Arrays.asList(num(1), num(2)));
		check(labelled);
		checker.checkInitialiser(array(intType(), 2), labelled);
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.FIELD_NAME_IN_ARRAY_INITIALISER), reasons());
	}

	@Test
	public void invalidInitialiser() {
		Expression init = num(1);
		assertSame(init, checker.checkInitialiser(chanType(), init));
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.INVALID_INITIALISER), reasons());
	}

	@Test
	public void mathFunctions() {
		assertEquals(TypeKind.DOUBLE, check(nary(ExpressionKind.SQRT_F, num(4))));
		assertEquals(TypeKind.BOOL, check(nary(ExpressionKind.ISNAN_F, real(1.0))));
		assertEquals(TypeKind.DOUBLE, check(nary(ExpressionKind.LDEXP_F, real(1.0), num(3))));

		assertFalse(checker.checkExpression(nary(ExpressionKind.POW_F, real(2.0))));
		assertFalse(checker.checkExpression(nary(ExpressionKind.ABS_F, real(1.5))));
		assertFalse(checker.checkExpression(nary(ExpressionKind.LDEXP_F, real(1.0), real(3.0))));
		assertEquals(Arrays.asList(
				TypeCheckingIssue.Reason.WRONG_NUMBER_OF_ARGUMENTS,
				TypeCheckingIssue.Reason.INTEGER_EXPECTED,
				TypeCheckingIssue.Reason.INTEGER_EXPECTED), reasons());
	}

	// exit is only meaningful inside a dynamic template
	// the unused left operand of a comma is reported once, however often the comma is checked
	@Test
	public void recheckComma() {
		Expression e = comma(num(1), assign(id(x), num(2)));
		assertTrue(checker.checkExpression(e));
		assertEquals(1, ctx.getWarnings().size());
		assertTrue(checker.checkExpression(e));
		assertEquals(1, ctx.getWarnings().size());
		assertFalse(ctx.hasErrors());
	}

	// exists (i : int[0,2]) c = 0 is neither a condition nor side-effect free
	@Test
	public void quantifierBodyWithWrongTypeAndSideEffect() {
		Symbol i = new Frame().add("i", range(0, 2));
		assertFalse(checker.checkExpression(exists(i, assign(id(c), num(0)))));
		assertEquals(Arrays.asList(TypeCheckingIssue.Reason.BOOLEAN_EXPECTED,
				TypeCheckingIssue.Reason.EXPRESSION_MUST_BE_SIDE_EFFECT_FREE), reasons());
	}

	@Test
	public void quantifiers() {
		Symbol i = new Frame().add("i", range(0, 2));
		assertEquals(TypeKind.BOOL, check(forall(i, gt(index(id(arr), id(i)), num(0)))));
		assertEquals(TypeKind.INT, check(sum(i, index(id(arr), id(i)))));
		assertFalse(checker.checkExpression(sum(i, assign(id(x), id(i)))));
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.EXPRESSION_MUST_BE_SIDE_EFFECT_FREE), reasons());
	}

	private Template dynamicTemplate(String name, boolean defined) {
		Frame parameters = system.newParameterFrame();
		parameters.add("id", intType());
		return system.addDynamicTemplate(name, parameters, defined);
	}

	@Test
	public void spawnAndNumOf() {
		Template worker = dynamicTemplate("Worker", true);
		assertEquals(TypeKind.INT, check(spawn(worker.getUid(), num(3))));
		assertEquals(TypeKind.INT, check(numOf(worker.getUid())));
		assertFalse(ctx.hasErrors());
	}

	@Test
	public void spawnNonDynamicTemplate() {
		Template plain = system.addTemplate("Plain", system.newParameterFrame());
		assertFalse(checker.checkExpression(spawn(plain.getUid())));
		assertFalse(checker.checkExpression(numOf(plain.getUid())));
		assertEquals(Arrays.asList(TypeCheckingIssue.Reason.SPAWN_NON_DYNAMIC,
				TypeCheckingIssue.Reason.NOT_A_DYNAMIC_TEMPLATE), reasons());
	}

	@Test
	public void spawnWithWrongNumberOfArguments() {
		Template worker = dynamicTemplate("Worker", true);
		assertFalse(checker.checkExpression(spawn(worker.getUid())));
		assertFalse(checker.checkExpression(spawn(worker.getUid(), num(1), num(2))));
		assertEquals(Arrays.asList(TypeCheckingIssue.Reason.WRONG_NUMBER_OF_ARGUMENTS,
				TypeCheckingIssue.Reason.WRONG_NUMBER_OF_ARGUMENTS), reasons());
	}

	// a dynamic template that is only declared cannot be spawned, but can be counted
	@Test
	public void spawnUndefinedTemplate() {
		Template lazy = dynamicTemplate("Lazy", false);
		assertFalse(checker.checkExpression(spawn(lazy.getUid(), num(1))));
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.TEMPLATE_NOT_DEFINED), reasons());
		assertEquals("Lazy", ((TypeCheckingIssue) ctx.getIssues().get(0)).getDetail());
		assertEquals(TypeKind.INT, check(numOf(lazy.getUid())));
	}

	@Test
	public void exitInsideTemplate() {
		checker.setTemplate(dynamicTemplate("Worker", true));
		assertEquals(TypeKind.INT, check(exit()));
		checker.setTemplate(system.addTemplate("Plain", system.newParameterFrame()));
		assertFalse(checker.checkExpression(exit()));
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.EXIT_IN_NON_DYNAMIC_TEMPLATE), reasons());
	}

	@Test
	public void exitOutsideTemplate() {
		assertFalse(checker.checkExpression(exit()));
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.EXIT_OUTSIDE_TEMPLATE), reasons());
	}

	@Test
	public void illegalPrefixes() {
		checker.checkType(urgent(intType()));
		checker.checkType(broadcast(intType()));
		checker.checkType(record(Collections.singletonList("f"), Collections.singletonList(doubleType())));
		assertEquals(Arrays.asList(
				TypeCheckingIssue.Reason.PREFIX_URGENT_ONLY_LOCATIONS_AND_CHANNELS,
				TypeCheckingIssue.Reason.PREFIX_BROADCAST_ONLY_CHANNELS,
				TypeCheckingIssue.Reason.NOT_ALLOWED_IN_STRUCT), reasons());
	}

	@Test
	public void constClock() {
		checker.checkType(constant(clockType()));
		assertThat(reasons(), hasItem(TypeCheckingIssue.Reason.PREFIX_CONST_NOT_ALLOWED_FOR_CLOCKS));
	}

	// int[0, x] is not a valid type since x is not known before the model runs
	@Test
	public void rangeBoundsMustBeComputable() {
		checker.checkType(range(intType(), num(0), id(x)));
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.MUST_BE_COMPUTABLE_AT_COMPILE_TIME), reasons());
		checker.checkType(range(intType(), num(0), id(k)));
		assertEquals(1, ctx.getIssues().size());
	}

	// a constant 1 is an empty update, any other value without effect is suspicious
	@Test
	public void ignoredValues() {
		assertTrue(checker.checkAssignmentExpression(num(1)));
		assertFalse(ctx.hasWarnings());
		assertTrue(checker.checkAssignmentExpression(plus(id(x), num(1))));
		assertEquals(1, ctx.getWarnings().size());
		assertTrue(checker.checkAssignmentExpression(assign(id(x), num(1))));
		assertEquals(1, ctx.getWarnings().size());
		assertFalse(ctx.hasErrors());
	}

	// Pr[<=10](<> x > 3) and Pr[<=10]([] x > 3) >= 0.5
	@Test
	public void probabilityQueries() {
		assertEquals(TypeKind.FORMULA, check(nary(ExpressionKind.PROBADIAMOND,
				num(0), num(-1), num(10), gt(id(x), num(3)), bool(true))));
		assertEquals(TypeKind.FORMULA, check(nary(ExpressionKind.PROBAMINBOX,
				num(0), num(-1), num(10), gt(id(x), num(3)), real(0.5))));
		assertFalse(ctx.hasErrors());
	}

	// every sub-check reports, not only the first failing one
	@Test
	public void probabilityQuerySubChecks() {
		assertFalse(checker.checkExpression(nary(ExpressionKind.PROBADIAMOND,
				num(0), num(-1), id(x), assign(id(x), num(1)), bool(true))));
		assertEquals(Arrays.asList(TypeCheckingIssue.Reason.MUST_BE_COMPUTABLE_AT_COMPILE_TIME,
				TypeCheckingIssue.Reason.PROPERTY_MUST_BE_SIDE_EFFECT_FREE), reasons());
	}

	@Test
	public void probabilityBounds() {
		assertFalse(checker.checkExpression(nary(ExpressionKind.PROBAMINBOX,
				num(5), num(-1), num(10), gt(id(x), num(3)), num(1))));
		assertEquals(Arrays.asList(TypeCheckingIssue.Reason.EXPLICIT_RUN_COUNT_UNSUPPORTED,
				TypeCheckingIssue.Reason.PROBABILITY_BOUND_EXPECTED), reasons());
	}

	// Pr[] only accepts false as its until condition
	@Test
	public void boxUntilMustBeFalse() {
		assertEquals(TypeKind.FORMULA, check(nary(ExpressionKind.PROBABOX,
				num(0), num(-1), num(10), gt(id(x), num(3)), bool(false))));
		assertFalse(checker.checkExpression(nary(ExpressionKind.PROBABOX,
				num(0), num(-1), num(10), gt(id(x), num(3)), bool(true))));
		assertEquals(Collections.singletonList(TypeCheckingIssue.Reason.MUST_BE_FALSE), reasons());
	}

	@Test
	public void simulate() {
		assertEquals(TypeKind.FORMULA, check(nary(ExpressionKind.SIMULATE,
				num(10), num(-1), num(100), id(x), id(c))));
		assertFalse(checker.checkExpression(nary(ExpressionKind.SIMULATE,
				num(0), num(-1), num(100), id(x))));
		assertFalse(checker.checkExpression(nary(ExpressionKind.SIMULATE,
				num(1), id(x), num(100), id(x))));
		assertEquals(Arrays.asList(TypeCheckingIssue.Reason.INVALID_RUN_COUNT,
				TypeCheckingIssue.Reason.CLOCK_EXPECTED), reasons());
	}

	// malformed statistical queries are internal errors, not type errors
	@Test
	public void statisticalArityMismatch() {
		Expression query = nary(ExpressionKind.PROBAEXP, num(0), num(-1));
		assertFalse(checker.checkExpression(query));
		assertEquals(1, ctx.getIssues().size());
		Issue issue = ctx.getIssues().get(0).unwrap();
		assertTrue(issue instanceof InternalConsistencyIssue);
		assertEquals(InternalConsistencyIssue.Reason.WRONG_NUMBER_OF_ARGUMENTS,
				((InternalConsistencyIssue) issue).getReason());
		assertEquals("Bug: wrong number of arguments", issue.getMessage());
	}

	// E[<=10; 100](max: x) is fine, an aggregation operator other than min or max is not
	@Test
	public void expectationQuery() {
		assertEquals(TypeKind.FORMULA, check(nary(ExpressionKind.PROBAEXP,
				num(100), num(-1), num(10), num(1), id(x))));
		assertFalse(checker.checkExpression(nary(ExpressionKind.PROBAEXP,
				num(100), num(-1), num(10), num(2), id(x))));
		Issue issue = ctx.getIssues().get(0).unwrap();
		assertEquals(InternalConsistencyIssue.Reason.BAD_AGGREGATION_OPERATOR_VALUE,
				((InternalConsistencyIssue) issue).getReason());
	}

}
