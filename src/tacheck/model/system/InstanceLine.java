package tacheck.model.system;

import tacheck.scope.Symbol;

/**
 * The life line of one process instance in a live sequence chart.
 */
public class InstanceLine {

	private final Symbol uid;
	private final int instanceNr;

	public InstanceLine(Symbol uid, int instanceNr) {
		this.uid = uid;
		this.instanceNr = instanceNr;
	}

	public Symbol getUid() {
		return uid;
	}

	public int getInstanceNr() {
		return instanceNr;
	}

}
