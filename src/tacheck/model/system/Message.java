package tacheck.model.system;

import tacheck.model.expr.Expression;

/**
 * A message between two instance lines of a live sequence chart. The label is a channel
 * synchronisation.
 */
public class Message {

	private final InstanceLine src;
	private final InstanceLine dst;
	private final int location;
	private final Expression label;

	public Message(InstanceLine src, InstanceLine dst, int location, Expression label) {
		this.src = src;
		this.dst = dst;
		this.location = location;
		this.label = label;
	}

	public InstanceLine getSrc() {
		return src;
	}

	public InstanceLine getDst() {
		return dst;
	}

	public int getLocation() {
		return location;
	}

	public Expression getLabel() {
		return label;
	}

}
