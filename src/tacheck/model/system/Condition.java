package tacheck.model.system;

import java.util.Collections;
import java.util.List;

import tacheck.model.expr.Expression;

public class Condition {

	private final List<InstanceLine> anchors;
	private final int location;
	private final Expression label;
	private final boolean hot;

	public Condition(List<InstanceLine> anchors, int location, Expression label, boolean hot) {
		this.anchors = anchors;
		this.location = location;
		this.label = label;
		this.hot = hot;
	}

	public List<InstanceLine> getAnchors() {
		return Collections.unmodifiableList(anchors);
	}

	public int getLocation() {
		return location;
	}

	public Expression getLabel() {
		return label;
	}

	public boolean isHot() {
		return hot;
	}

}
