package tacheck.model.system;

import java.util.Collections;
import java.util.List;

import tacheck.model.expr.Expression;

/**
 * Declares the input, output and CSP channels of a process for compositional analyses.
 */
public class IODecl {

	private final String instanceName;
	private final List<Expression> param;
	private final List<Expression> inputs;
	private final List<Expression> outputs;
	private final List<Expression> csp;

	public IODecl(String instanceName, List<Expression> param, List<Expression> inputs,
	              List<Expression> outputs, List<Expression> csp) {
		this.instanceName = instanceName;
		this.param = param;
		this.inputs = inputs;
		this.outputs = outputs;
		this.csp = csp;
	}

	public String getInstanceName() {
		return instanceName;
	}

	public List<Expression> getParam() {
		return Collections.unmodifiableList(param);
	}

	public List<Expression> getInputs() {
		return Collections.unmodifiableList(inputs);
	}

	public List<Expression> getOutputs() {
		return Collections.unmodifiableList(outputs);
	}

	public List<Expression> getCsp() {
		return Collections.unmodifiableList(csp);
	}

}
