package tacheck.model.system;

import java.util.Collections;
import java.util.List;

import tacheck.model.expr.Expression;

/**
 * One channel priority declaration, e.g. {@code chan priority a < b, c < default}. A null
 * channel stands for the default priority.
 */
public class ChanPriority {

	private final Expression head;
	private final List<Expression> tail;

	public ChanPriority(Expression head, List<Expression> tail) {
		this.head = head;
		this.tail = tail;
	}

	public Expression getHead() {
		return head;
	}

	public List<Expression> getTail() {
		return Collections.unmodifiableList(tail);
	}

}
