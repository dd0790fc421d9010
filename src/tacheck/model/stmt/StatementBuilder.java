package tacheck.model.stmt;

import tacheck.model.expr.Expression;
import tacheck.scope.Frame;
import tacheck.scope.Symbol;
import tacheck.util.SourceLocation;

import java.util.Arrays;

public class StatementBuilder {
	private StatementBuilder() {}

	public static EmptyStatement empty() {
		return new EmptyStatement(SourceLocation.unknown());
	}

	public static ExpressionStatement expr(Expression expression) {
		return new ExpressionStatement(SourceLocation.unknown(), expression);
	}

	public static AssertStatement assertion(Expression expression) {
		return new AssertStatement(SourceLocation.unknown(), expression);
	}

	public static ForStatement forLoop(Expression init, Expression condition, Expression step, Statement body) {
		return new ForStatement(SourceLocation.unknown(), init, condition, step, body);
	}

	public static IterationStatement iteration(Symbol symbol, Frame frame, Statement body) {
		return new IterationStatement(SourceLocation.unknown(), symbol, frame, body);
	}

	public static WhileStatement whileLoop(Expression condition, Statement body) {
		return new WhileStatement(SourceLocation.unknown(), condition, body);
	}

	public static DoWhileStatement doWhile(Statement body, Expression condition) {
		return new DoWhileStatement(SourceLocation.unknown(), body, condition);
	}

	public static BlockStatement block(Frame frame, Statement... statements) {
		return new BlockStatement(SourceLocation.unknown(), frame, Arrays.asList(statements));
	}

	public static BlockStatement block(Statement... statements) {
		return block(new Frame(), statements);
	}

	public static SwitchStatement switchStatement(Frame frame, Expression condition, Statement... statements) {
		return new SwitchStatement(SourceLocation.unknown(), frame, condition, Arrays.asList(statements));
	}

	public static CaseStatement caseStatement(Frame frame, Expression condition, Statement... statements) {
		return new CaseStatement(SourceLocation.unknown(), frame, condition, Arrays.asList(statements));
	}

	public static DefaultStatement defaultStatement(Frame frame, Statement... statements) {
		return new DefaultStatement(SourceLocation.unknown(), frame, Arrays.asList(statements));
	}

	public static IfStatement ifThen(Expression condition, Statement trueCase) {
		return new IfStatement(SourceLocation.unknown(), condition, trueCase, null);
	}

	public static IfStatement ifThenElse(Expression condition, Statement trueCase, Statement falseCase) {
		return new IfStatement(SourceLocation.unknown(), condition, trueCase, falseCase);
	}

	public static BreakStatement breakStatement() {
		return new BreakStatement(SourceLocation.unknown());
	}

	public static ContinueStatement continueStatement() {
		return new ContinueStatement(SourceLocation.unknown());
	}

	public static ReturnStatement returnStatement() {
		return new ReturnStatement(SourceLocation.unknown(), null);
	}

	public static ReturnStatement returnStatement(Expression value) {
		return new ReturnStatement(SourceLocation.unknown(), value);
	}
}
