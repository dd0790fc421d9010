package tacheck.model.stmt;

public abstract class StatementVisitor<T, E extends Throwable> {
	public abstract T visit(EmptyStatement emptyStatement) throws E;
	public abstract T visit(ExpressionStatement expressionStatement) throws E;
	public abstract T visit(AssertStatement assertStatement) throws E;
	public abstract T visit(ForStatement forStatement) throws E;
	public abstract T visit(IterationStatement iterationStatement) throws E;
	public abstract T visit(WhileStatement whileStatement) throws E;
	public abstract T visit(DoWhileStatement doWhileStatement) throws E;
	public abstract T visit(BlockStatement blockStatement) throws E;
	public abstract T visit(SwitchStatement switchStatement) throws E;
	public abstract T visit(CaseStatement caseStatement) throws E;
	public abstract T visit(DefaultStatement defaultStatement) throws E;
	public abstract T visit(IfStatement ifStatement) throws E;
	public abstract T visit(BreakStatement breakStatement) throws E;
	public abstract T visit(ContinueStatement continueStatement) throws E;
	public abstract T visit(ReturnStatement returnStatement) throws E;
}
