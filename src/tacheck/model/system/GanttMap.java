package tacheck.model.system;

import tacheck.model.expr.Expression;
import tacheck.scope.Frame;

/**
 * One row of a Gantt chart: while the predicate holds, the chart shows the mapped value.
 */
public class GanttMap {

	private final Frame parameters;
	private final Expression predicate;
	private final Expression mapping;

	public GanttMap(Frame parameters, Expression predicate, Expression mapping) {
		this.parameters = parameters;
		this.predicate = predicate;
		this.mapping = mapping;
	}

	public Frame getParameters() {
		return parameters;
	}

	public Expression getPredicate() {
		return predicate;
	}

	public Expression getMapping() {
		return mapping;
	}

}
