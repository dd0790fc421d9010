package tacheck.trans.passes.typecheck;

import org.junit.Before;
import org.junit.Test;
import tacheck.TypeCheckerOptions;
import tacheck.model.system.Declarations;
import tacheck.model.system.Template;
import tacheck.model.system.TimedAutomataSystem;
import tacheck.scope.Symbol;

import static org.junit.Assert.*;
import static tacheck.model.expr.ExpressionBuilder.*;
import static tacheck.model.type.TypeBuilder.*;

public class TypeCheckingPassTest {

	private TimedAutomataSystem system;
	private Symbol c;
	private Symbol k;

	@Before
	public void setup() {
		system = new TimedAutomataSystem();
		Declarations globals = system.getGlobals();
		c = globals.addVariable("c", clockType(), null).getUid();
		k = globals.addVariable("k", constant(intType()), num(4)).getUid();
	}

	private Template template() {
		return system.addTemplate("P", system.newParameterFrame());
	}

	@Test
	public void emptySystem() {
		assertTrue(TypeCheckingPass.perform(system, new TypeCheckerOptions()));
		assertFalse(system.hasErrors());
	}

	@Test
	public void errorsFailThePass() {
		template().addState("s0", eq(id(c), num(5)));
		assertFalse(TypeCheckingPass.perform(system, new TypeCheckerOptions()));
		assertTrue(system.hasErrors());
	}

	// warnings alone do not fail the pass
	@Test
	public void warningsDoNotFailThePass() {
		template().addState("s0", lt(id(c), num(5)));
		assertTrue(TypeCheckingPass.perform(system, new TypeCheckerOptions().withStrictInvariantWarnings(true)));
		assertTrue(system.hasWarnings());
		assertFalse(system.hasErrors());
	}

	// queries checked later reuse the declarations of the checked system
	@Test
	public void checkExpressionAfterPass() {
		assertTrue(TypeCheckingPass.perform(system, new TypeCheckerOptions()));
		assertTrue(TypeCheckingPass.checkExpression(system, le(id(c), id(k))));
		assertFalse(system.hasErrors());
		assertFalse(TypeCheckingPass.checkExpression(system, assign(id(k), num(1))));
		assertTrue(system.hasErrors());
	}

}
