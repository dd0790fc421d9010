package tacheck.model.system;

import tacheck.model.expr.Expression;
import tacheck.model.stmt.BlockStatement;
import tacheck.model.type.Type;
import tacheck.scope.Frame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The declarations of one scope, either global or local to a template.
 */
public class Declarations {

	private final Frame frame;
	private final List<Variable> variables = new ArrayList<>();
	private final List<Function> functions = new ArrayList<>();
	private final List<Progress> progress = new ArrayList<>();
	private final List<IODecl> ioDecls = new ArrayList<>();
	private final List<GanttChart> ganttCharts = new ArrayList<>();
	private final List<Expression> hybridClocks = new ArrayList<>();

	public Declarations(Frame frame) {
		this.frame = frame;
	}

	public Frame getFrame() {
		return frame;
	}

	public Variable addVariable(String name, Type type, Expression init) {
		Variable variable = Variable.declare(frame, name, type, init);
		variables.add(variable);
		return variable;
	}

	public Function addFunction(String name, Type type, BlockStatement body, List<Variable> locals) {
		Function function = Function.declare(frame, name, type, body, locals);
		functions.add(function);
		return function;
	}

	public Progress addProgress(Expression guard, Expression measure) {
		Progress p = new Progress(guard, measure);
		progress.add(p);
		return p;
	}

	public void addIODecl(IODecl ioDecl) {
		ioDecls.add(ioDecl);
	}

	public void addGanttChart(GanttChart ganttChart) {
		ganttCharts.add(ganttChart);
	}

	public void addHybridClock(Expression clock) {
		hybridClocks.add(clock);
	}

	public List<Variable> getVariables() {
		return Collections.unmodifiableList(variables);
	}

	public List<Function> getFunctions() {
		return Collections.unmodifiableList(functions);
	}

	public List<Progress> getProgress() {
		return Collections.unmodifiableList(progress);
	}

	public List<IODecl> getIODecls() {
		return Collections.unmodifiableList(ioDecls);
	}

	public List<GanttChart> getGanttCharts() {
		return Collections.unmodifiableList(ganttCharts);
	}

	public List<Expression> getHybridClocks() {
		return Collections.unmodifiableList(hybridClocks);
	}

	void accept(SystemVisitor v) {
		for (Variable variable : variables) {
			v.visitVariable(variable);
		}
		for (Function function : functions) {
			v.visitFunction(function);
		}
		for (Progress p : progress) {
			v.visitProgressMeasure(p);
		}
		for (IODecl ioDecl : ioDecls) {
			v.visitIODecl(ioDecl);
		}
		for (GanttChart ganttChart : ganttCharts) {
			v.visitGanttChart(ganttChart);
		}
		for (Expression clock : hybridClocks) {
			v.visitHybridClock(clock);
		}
	}

}
