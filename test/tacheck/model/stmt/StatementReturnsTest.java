package tacheck.model.stmt;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import tacheck.scope.Frame;

import static tacheck.model.expr.ExpressionBuilder.*;
import static tacheck.model.stmt.StatementBuilder.*;

@RunWith(Parameterized.class)
public class StatementReturnsTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				// ;
				{empty(), false},
				// 1;
				{expr(num(1)), false},
				// assert(1);
				{assertion(num(1)), false},
				// return;
				{returnStatement(), true},
				// return 1;
				{returnStatement(num(1)), true},
				// break;
				{breakStatement(), false},
				// continue;
				{continueStatement(), false},
				// {}
				{block(), false},
				// { return 1; }
				{block(returnStatement(num(1))), true},
				// { return 1; 2; }
				{block(returnStatement(num(1)), expr(num(2))), false},
				// { 2; return 1; }
				{block(expr(num(2)), returnStatement(num(1))), true},
				// { { return 1; } }
				{block(block(returnStatement(num(1)))), true},
				// if (1) return 1;
				{ifThen(num(1), returnStatement(num(1))), false},
				// if (1) return 1; else return 2;
				{ifThenElse(num(1), returnStatement(num(1)), returnStatement(num(2))), true},
				// if (1) return 1; else ;
				{ifThenElse(num(1), returnStatement(num(1)), empty()), false},
				// if (1) ; else return 2;
				{ifThenElse(num(1), empty(), returnStatement(num(2))), false},
				// if (1) { if (0) return 1; else return 2; } else { return 3; }
				{ifThenElse(num(1),
						block(ifThenElse(num(0), returnStatement(num(1)), returnStatement(num(2)))),
						block(returnStatement(num(3)))), true},
				// { if (1) return 1; }
				{block(ifThen(num(1), returnStatement(num(1)))), false},
				// while (1) return 1;
				{whileLoop(num(1), returnStatement(num(1))), false},
				// do return 1; while (1);
				{doWhile(returnStatement(num(1)), num(1)), true},
				// do ; while (1);
				{doWhile(empty(), num(1)), false},
				// do { if (1) return 1; else return 2; } while (1);
				{doWhile(block(ifThenElse(num(1), returnStatement(num(1)), returnStatement(num(2)))), num(1)), true},
				// for (;;) return 1;
				{forLoop(null, num(1), null, returnStatement(num(1))), false},
				// switch (1) { case 1: return 1; default: return 2; }
				{switchStatement(new Frame(), num(1),
						caseStatement(new Frame(), num(1), returnStatement(num(1))),
						defaultStatement(new Frame(), returnStatement(num(2)))), false},
				// case 1: return 1;
				{caseStatement(new Frame(), num(1), returnStatement(num(1))), false},
				// default: return 2;
				{defaultStatement(new Frame(), returnStatement(num(2))), false},
		});
	}

	private final Statement statement;
	private final boolean returns;

	public StatementReturnsTest(Statement statement, boolean returns) {
		this.statement = statement;
		this.returns = returns;
	}

	@Test
	public void test() {
		assertEquals(returns, statement.returns());
	}

}
