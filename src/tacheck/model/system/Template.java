package tacheck.model.system;

import tacheck.model.expr.Expression;
import tacheck.model.type.TypeBuilder;
import tacheck.scope.Frame;
import tacheck.scope.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A process template: a parameterised timed automaton, or a live sequence chart, with its own
 * local declarations. A template is also an instance of itself in which every parameter is
 * unbound.
 */
public class Template extends Instance {

	private final boolean dynamic;
	private final boolean defined;
	private final Declarations declarations;
	private final List<State> states = new ArrayList<>();
	private final List<Edge> edges = new ArrayList<>();
	private final List<InstanceLine> instanceLines = new ArrayList<>();
	private final List<Message> messages = new ArrayList<>();
	private final List<Condition> conditions = new ArrayList<>();
	private final List<Update> updates = new ArrayList<>();

	Template(Frame parameters, boolean dynamic, boolean defined) {
		super(null, parameters, parameters.getSize(), 0);
		this.dynamic = dynamic;
		this.defined = defined;
		this.declarations = new Declarations(new Frame(parameters));
	}

	@Override
	public Template getTemplate() {
		return this;
	}

	public boolean isDynamic() {
		return dynamic;
	}

	/**
	 * @return false for dynamic templates that are only declared, never given a body
	 */
	public boolean isDefined() {
		return defined;
	}

	public Declarations getDeclarations() {
		return declarations;
	}

	public State addState(String name, Expression invariant) {
		return addState(name, invariant, null);
	}

	public State addState(String name, Expression invariant, Expression exponentialRate) {
		Frame frame = declarations.getFrame();
		Symbol uid = frame.add(name, TypeBuilder.locationType());
		State state = new State(uid, invariant, exponentialRate);
		uid.setData(state);
		states.add(state);
		return state;
	}

	public Edge addEdge(State src, State dst, boolean control) {
		return addEdge(src, dst, control, new Frame(declarations.getFrame()));
	}

	public Edge addEdge(State src, State dst, boolean control, Frame select) {
		Edge edge = new Edge(src, dst, control, select);
		edges.add(edge);
		return edge;
	}

	public InstanceLine addInstanceLine(Symbol uid) {
		InstanceLine line = new InstanceLine(uid, instanceLines.size());
		instanceLines.add(line);
		return line;
	}

	public Message addMessage(InstanceLine src, InstanceLine dst, int location, Expression label) {
		Message message = new Message(src, dst, location, label);
		messages.add(message);
		return message;
	}

	public Condition addCondition(List<InstanceLine> anchors, int location, Expression label, boolean hot) {
		Condition condition = new Condition(anchors, location, label, hot);
		conditions.add(condition);
		return condition;
	}

	public Update addUpdate(InstanceLine anchor, int location, Expression label) {
		Update update = new Update(anchor, location, label);
		updates.add(update);
		return update;
	}

	public List<State> getStates() {
		return Collections.unmodifiableList(states);
	}

	public List<Edge> getEdges() {
		return Collections.unmodifiableList(edges);
	}

	public List<InstanceLine> getInstanceLines() {
		return Collections.unmodifiableList(instanceLines);
	}

	public List<Message> getMessages() {
		return Collections.unmodifiableList(messages);
	}

	public List<Condition> getConditions() {
		return Collections.unmodifiableList(conditions);
	}

	public List<Update> getUpdates() {
		return Collections.unmodifiableList(updates);
	}

	void accept(SystemVisitor v) {
		if (!v.visitTemplateBefore(this)) {
			return;
		}
		declarations.accept(v);
		for (State state : states) {
			v.visitState(state);
		}
		for (Edge edge : edges) {
			v.visitEdge(edge);
		}
		for (InstanceLine line : instanceLines) {
			v.visitInstanceLine(line);
		}
		for (Message message : messages) {
			v.visitMessage(message);
		}
		for (Condition condition : conditions) {
			v.visitCondition(condition);
		}
		for (Update update : updates) {
			v.visitUpdate(update);
		}
		v.visitTemplateAfter(this);
	}

}
