package tacheck.model.system;

import tacheck.model.expr.Expression;

/**
 * Callbacks for {@link TimedAutomataSystem#accept(SystemVisitor)}. Every callback does nothing
 * by default, so analyses only override the entities they are interested in.
 */
public abstract class SystemVisitor {

	/**
	 * @return whether the declarations, templates, instances, processes and properties of the
	 * system should be visited
	 */
	public boolean visitSystemBefore(TimedAutomataSystem system) {
		return true;
	}

	public void visitSystemAfter(TimedAutomataSystem system) {
	}

	public void visitVariable(Variable variable) {
	}

	public void visitFunction(Function function) {
	}

	public void visitProgressMeasure(Progress progress) {
	}

	public void visitIODecl(IODecl ioDecl) {
	}

	public void visitGanttChart(GanttChart ganttChart) {
	}

	public void visitHybridClock(Expression clock) {
	}

	/**
	 * @return whether the contents of the template should be visited
	 */
	public boolean visitTemplateBefore(Template template) {
		return true;
	}

	public void visitTemplateAfter(Template template) {
	}

	public void visitState(State state) {
	}

	public void visitEdge(Edge edge) {
	}

	public void visitInstanceLine(InstanceLine instanceLine) {
	}

	public void visitMessage(Message message) {
	}

	public void visitCondition(Condition condition) {
	}

	public void visitUpdate(Update update) {
	}

	public void visitInstance(Instance instance) {
	}

	public void visitProcess(Instance process) {
	}

	public void visitProperty(Expression property) {
	}

}
