package tacheck.trans.passes.typecheck;

import org.junit.Before;
import org.junit.Test;
import tacheck.InternalCompilerError;
import tacheck.errors.TopLevelIssueContext;
import tacheck.model.expr.Expression;
import tacheck.model.expr.ExpressionKind;
import tacheck.model.system.Declarations;
import tacheck.model.system.TimedAutomataSystem;
import tacheck.model.type.TypeKind;
import tacheck.scope.Frame;
import tacheck.scope.Symbol;

import static org.junit.Assert.*;
import static tacheck.model.expr.ExpressionBuilder.*;
import static tacheck.model.type.TypeBuilder.*;

public class RateDecomposerTest {

	private TopLevelIssueContext ctx;
	private ExpressionTypeChecker checker;
	private RateDecomposer decomposer;

	private Symbol c;
	private Symbol cost;
	private Symbol clocks;

	@Before
	public void setup() {
		TimedAutomataSystem system = new TimedAutomataSystem();
		Declarations globals = system.getGlobals();
		c = globals.addVariable("c", clockType(), null).getUid();
		cost = globals.addVariable("cost", costType(), null).getUid();
		clocks = globals.addVariable("cs", array(clockType(), 3), null).getUid();
		CompileTimeComputableValues computable = new CompileTimeComputableValues();
		system.accept(computable);
		ctx = new TopLevelIssueContext();
		checker = new ExpressionTypeChecker(system, computable, ctx);
		decomposer = new RateDecomposer();
	}

	private Expression checked(Expression expr) {
		assertTrue(checker.checkExpression(expr));
		return expr;
	}

	// c <= 10 && cost' == 2
	@Test
	public void costRateIsSplitOff() {
		Expression bound = le(id(c), num(10));
		Expression two = num(2);
		decomposer.decompose(checked(and(bound, eq(rate(id(cost)), two))));
		assertSame(bound, decomposer.getInvariant());
		assertEquals(TypeKind.INVARIANT, decomposer.getInvariant().getType().getKind());
		assertSame(two, decomposer.getCostRate());
		assertEquals(1, decomposer.getCountCostRates());
		assertFalse(decomposer.hasClockRates());
		assertFalse(decomposer.hasStrictInvariant());
		assertFalse(ctx.hasErrors());
	}

	// the cost rate may also be written the other way round
	@Test
	public void costRateOnTheRight() {
		Expression three = num(3);
		decomposer.decompose(checked(eq(three, rate(id(cost)))));
		assertSame(three, decomposer.getCostRate());
		assertTrue(decomposer.getInvariant().isTrue());
	}

	@Test
	public void strictInvariant() {
		Expression bound = lt(id(c), num(5));
		decomposer.decompose(checked(bound));
		assertTrue(decomposer.hasStrictInvariant());
		assertSame(bound, decomposer.getInvariant());
		assertNull(decomposer.getCostRate());
	}

	// only strict upper bounds make an invariant strict
	@Test
	public void strictLowerBoundIsNotStrictInvariant() {
		Expression bound = gt(id(c), num(5));
		decomposer.decompose(checked(bound));
		assertEquals(TypeKind.INVARIANT, bound.getType().getKind());
		assertFalse(decomposer.hasStrictInvariant());
		assertSame(bound, decomposer.getInvariant());
	}

	// c <= 10 && c' == 0 keeps the clock rate as part of the invariant
	@Test
	public void clockRateStaysInInvariant() {
		Expression bound = le(id(c), num(10));
		Expression stopped = eq(rate(id(c)), num(0));
		decomposer.decompose(checked(and(bound, stopped)));
		assertTrue(decomposer.hasClockRates());
		Expression invariant = decomposer.getInvariant();
		assertEquals(ExpressionKind.AND, invariant.getKind());
		assertEquals(TypeKind.INVARIANT_WR, invariant.getType().getKind());
		assertSame(bound, invariant.get(0));
		assertSame(stopped, invariant.get(1));
		assertNull(decomposer.getCostRate());
	}

	// every cost rate is counted, the last one wins
	@Test
	public void twoCostRates() {
		Expression second = num(2);
		decomposer.decompose(checked(and(eq(rate(id(cost)), num(1)), eq(rate(id(cost)), second))));
		assertEquals(2, decomposer.getCountCostRates());
		assertSame(second, decomposer.getCostRate());
		assertTrue(decomposer.getInvariant().isTrue());
	}

	// forall (i : int[0,2]) cs[i]' == 0 is kept whole, but its clock rates are noticed
	@Test
	public void quantifiedClockRates() {
		Frame frame = new Frame();
		Symbol i = frame.add("i", range(0, 2));
		Expression quantified = forall(i, eq(rate(index(id(clocks), id(i))), num(0)));
		decomposer.decompose(checked(quantified));
		assertTrue(decomposer.hasClockRates());
		assertSame(quantified, decomposer.getInvariant());
	}

	@Test(expected = InternalCompilerError.class)
	public void guardIsNotAnInvariant() {
		decomposer.decompose(checked(eq(id(c), num(3))));
	}

}
