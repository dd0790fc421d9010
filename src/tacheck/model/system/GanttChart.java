package tacheck.model.system;

import java.util.Collections;
import java.util.List;

import tacheck.scope.Frame;

public class GanttChart {

	private final String name;
	private final Frame parameters;
	private final List<GanttMap> mapping;

	public GanttChart(String name, Frame parameters, List<GanttMap> mapping) {
		this.name = name;
		this.parameters = parameters;
		this.mapping = mapping;
	}

	public String getName() {
		return name;
	}

	public Frame getParameters() {
		return parameters;
	}

	public List<GanttMap> getMapping() {
		return Collections.unmodifiableList(mapping);
	}

}
