package tacheck.model.system;

import tacheck.model.expr.Expression;

public class Update {

	private final InstanceLine anchor;
	private final int location;
	private final Expression label;

	public Update(InstanceLine anchor, int location, Expression label) {
		this.anchor = anchor;
		this.location = location;
		this.label = label;
	}

	public InstanceLine getAnchor() {
		return anchor;
	}

	public int getLocation() {
		return location;
	}

	public Expression getLabel() {
		return label;
	}

}
