package tacheck.trans.passes.typecheck;

import tacheck.model.expr.Expression;
import tacheck.model.stmt.*;
import tacheck.model.system.Function;
import tacheck.model.system.Variable;
import tacheck.model.type.Type;
import tacheck.model.type.TypeKind;
import tacheck.scope.Symbol;

/**
 * Checks the statements of a function body. Each expression is checked where it occurs, with
 * the rule of the position it occurs in: conditions must be integral, expression statements
 * must be assignment expressions, returned values must suit the function's return type.
 */
public class StatementTypeCheckingVisitor extends DescendingStatementVisitor<RuntimeException> {

	private final ExpressionTypeChecker checker;
	private final Function function;

	public StatementTypeCheckingVisitor(ExpressionTypeChecker checker, Function function) {
		this.checker = checker;
		this.function = function;
	}

	// for loops may omit their condition
	private void checkCondition(Expression condition) {
		if (condition != null && checker.checkExpression(condition)) {
			checker.checkConditionalExpressionInFunction(condition);
		}
	}

	@Override
	public Void visit(ExpressionStatement expressionStatement) {
		checker.checkAssignmentExpression(expressionStatement.getExpression());
		return null;
	}

	@Override
	public Void visit(AssertStatement assertStatement) {
		Expression expression = assertStatement.getExpression();
		if (checker.checkExpression(expression) && expression.changesAnyVariable()) {
			checker.error(TypeCheckingIssue.Reason.ASSERTION_MUST_BE_SIDE_EFFECT_FREE, expression);
		}
		return null;
	}

	@Override
	public Void visit(ForStatement forStatement) {
		checker.checkAssignmentExpression(forStatement.getInit());
		checkCondition(forStatement.getCondition());
		checker.checkAssignmentExpression(forStatement.getStep());
		return forStatement.getBody().accept(this);
	}

	@Override
	public Void visit(IterationStatement iterationStatement) {
		Type type = iterationStatement.getSymbol().getType();
		checker.checkType(type);
		// only integers and scalars can be iterated
		if (!type.isScalar() && !type.isInteger()) {
			checker.error(TypeCheckingIssue.Reason.SCALAR_SET_OR_INTEGER_EXPECTED, type, type.toString());
		} else if (!type.is(TypeKind.RANGE)) {
			checker.error(TypeCheckingIssue.Reason.RANGE_EXPECTED, type, type.toString());
		}
		return iterationStatement.getBody().accept(this);
	}

	@Override
	public Void visit(WhileStatement whileStatement) {
		checkCondition(whileStatement.getCondition());
		return whileStatement.getBody().accept(this);
	}

	@Override
	public Void visit(DoWhileStatement doWhileStatement) {
		checkCondition(doWhileStatement.getCondition());
		return doWhileStatement.getBody().accept(this);
	}

	/**
	 * Local variables, including the parameters in the outermost block, are declared in the
	 * block's frame. Their initialisers must be free of side effects, since the fields of a
	 * record initialiser may be evaluated in another order than they were written in.
	 */
	@Override
	public Void visit(BlockStatement blockStatement) {
		for (Symbol symbol : blockStatement.getFrame().getSymbols()) {
			checker.checkType(symbol.getType());
			if (!(symbol.getData() instanceof Variable)) {
				continue;
			}
			Variable variable = (Variable) symbol.getData();
			Expression init = variable.getInit();
			if (init != null && checker.checkExpression(init)) {
				if (init.changesAnyVariable()) {
					checker.error(TypeCheckingIssue.Reason.INITIALISER_MUST_BE_SIDE_EFFECT_FREE, init);
				} else {
					variable.setInit(checker.checkInitialiser(symbol.getType(), init));
				}
			}
		}
		return super.visit(blockStatement);
	}

	@Override
	public Void visit(SwitchStatement switchStatement) {
		checkCondition(switchStatement.getCondition());
		return visit((BlockStatement) switchStatement);
	}

	@Override
	public Void visit(CaseStatement caseStatement) {
		checkCondition(caseStatement.getCondition());
		return visit((BlockStatement) caseStatement);
	}

	@Override
	public Void visit(IfStatement ifStatement) {
		checkCondition(ifStatement.getCondition());
		return super.visit(ifStatement);
	}

	@Override
	public Void visit(ReturnStatement returnStatement) {
		Expression value = returnStatement.getValue();
		if (value != null && checker.checkExpression(value)) {
			// return values follow the rules of arguments
			checker.checkParameterCompatible(function.getReturnType(), value);
		}
		return null;
	}

}
