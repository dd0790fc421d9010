package tacheck.model.type;

import org.junit.Test;

import static org.junit.Assert.*;
import static tacheck.model.type.TypeBuilder.*;

public class TypeTest {

	// booleans sit at the bottom of the condition lattice
	@Test
	public void integralIsEverything() {
		Type b = boolType();
		assertTrue(b.isInvariant());
		assertTrue(b.isInvariantWR());
		assertTrue(b.isGuard());
		assertTrue(b.isConstraint());
		assertTrue(b.isFormula());
	}

	@Test
	public void invariantIsGuard() {
		Type inv = Type.primitive(TypeKind.INVARIANT);
		assertFalse(inv.isIntegral());
		assertTrue(inv.isInvariantWR());
		assertTrue(inv.isGuard());
		assertTrue(inv.isConstraint());
	}

	// rate equations cannot guard an edge
	@Test
	public void invariantWithRatesIsNoGuard() {
		Type inv = Type.primitive(TypeKind.INVARIANT_WR);
		assertTrue(inv.isInvariantWR());
		assertFalse(inv.isInvariant());
		assertFalse(inv.isGuard());
		assertFalse(inv.isConstraint());
	}

	@Test
	public void guardIsNoInvariant() {
		Type guard = Type.primitive(TypeKind.GUARD);
		assertFalse(guard.isInvariantWR());
		assertTrue(guard.isConstraint());
		assertTrue(guard.isFormula());
		assertFalse(Type.primitive(TypeKind.FORMULA).isConstraint());
	}

	// prefixes are transparent to kind queries
	@Test
	public void prefixesAreTransparent() {
		Type t = constant(range(0, 5));
		assertTrue(t.isInteger());
		assertTrue(t.isRange());
		assertTrue(t.is(TypeKind.CONSTANT));
		assertTrue(urgent(chanType()).isChannel());
		assertTrue(ref(array(clockType(), 3)).isArray());
	}

	@Test
	public void constness() {
		assertTrue(constant(intType()).isConstant());
		assertFalse(constant(intType()).isNonConstant());
		assertFalse(intType().isConstant());
		assertTrue(intType().isNonConstant());
		assertTrue(array(constant(intType()), 2).isConstant());
	}

}
