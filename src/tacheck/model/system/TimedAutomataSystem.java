package tacheck.model.system;

import tacheck.errors.IssueContext;
import tacheck.errors.TopLevelIssueContext;
import tacheck.model.expr.Expression;
import tacheck.model.type.Type;
import tacheck.scope.Frame;
import tacheck.scope.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * A complete model: global declarations, templates, their (partial) instances, the processes
 * of the system line and the properties to check. Analyses record facts about the model here
 * that later stages depend on, e.g. whether it uses stopwatches.
 */
public class TimedAutomataSystem {

	private static final Logger logger = Logger.getLogger("TimedAutomataSystem");

	private final Declarations globals = new Declarations(new Frame());
	private final List<Template> templates = new ArrayList<>();
	private final List<Instance> instances = new ArrayList<>();
	private final List<Instance> processes = new ArrayList<>();
	private final List<Expression> queries = new ArrayList<>();
	private final List<ChanPriority> chanPriorities = new ArrayList<>();
	private Expression beforeUpdate;
	private Expression afterUpdate;

	private final TopLevelIssueContext issues = new TopLevelIssueContext();

	private boolean hasStopWatch = false;
	private boolean hasStrictInvariants = false;
	private boolean hasStrictLowerBoundOnControllableEdges = false;
	private boolean hasStrictBound = false;
	private boolean hasUrgentTransition = false;
	private boolean hasClockGuardRecvBroadcast = false;
	private SyncUsage syncUsed = SyncUsage.UNUSED;

	public Declarations getGlobals() {
		return globals;
	}

	/**
	 * Creates a frame for the parameters of a new template, nested in the global scope.
	 */
	public Frame newParameterFrame() {
		return new Frame(globals.getFrame());
	}

	public Template addTemplate(String name, Frame parameters) {
		return addTemplate(name, parameters, false, true);
	}

	public Template addDynamicTemplate(String name, Frame parameters, boolean defined) {
		return addTemplate(name, parameters, true, defined);
	}

	private Template addTemplate(String name, Frame parameters, boolean dynamic, boolean defined) {
		Template template = new Template(parameters, dynamic, defined);
		template.setUid(globals.getFrame().add(name, Type.process(parameterTypes(parameters, 0)), template));
		templates.add(template);
		return template;
	}

	/**
	 * Declares a partial instance {@code name(free) = template(arguments)}.
	 *
	 * @param free the parameters left unbound by the instantiation
	 * @param arguments one argument per template parameter
	 */
	public Instance addInstance(String name, Template template, Frame free, List<Expression> arguments) {
		Frame templateParameters = template.getParameters();
		if (arguments.size() != templateParameters.getSize()) {
			throw new IllegalArgumentException("template " + template.getName() + " expects " +
					templateParameters.getSize() + " arguments, got " + arguments.size());
		}
		Frame parameters = new Frame(globals.getFrame());
		for (Symbol symbol : free.getSymbols()) {
			parameters.add(symbol);
		}
		for (Symbol symbol : templateParameters.getSymbols()) {
			parameters.add(symbol);
		}
		Instance instance = new Instance(template, parameters, free.getSize(), arguments.size());
		for (int i = 0; i < arguments.size(); ++i) {
			instance.bind(templateParameters.get(i), arguments.get(i));
		}
		instance.setUid(globals.getFrame().add(name, Type.instance(parameterTypes(free, 0)), instance));
		instances.add(instance);
		return instance;
	}

	private static List<Type> parameterTypes(Frame frame, int from) {
		List<Type> types = new ArrayList<>();
		for (int i = from; i < frame.getSize(); ++i) {
			types.add(frame.get(i).getType());
		}
		return types;
	}

	public void addProcess(Instance process) {
		processes.add(process);
	}

	public void addQuery(Expression property) {
		queries.add(property);
	}

	public void addChanPriority(ChanPriority priority) {
		chanPriorities.add(priority);
	}

	public List<Template> getTemplates() {
		return Collections.unmodifiableList(templates);
	}

	public List<Instance> getInstances() {
		return Collections.unmodifiableList(instances);
	}

	public List<Instance> getProcesses() {
		return Collections.unmodifiableList(processes);
	}

	public List<Expression> getQueries() {
		return Collections.unmodifiableList(queries);
	}

	public List<ChanPriority> getChanPriorities() {
		return Collections.unmodifiableList(chanPriorities);
	}

	/**
	 * @return the dynamic template with the given name, or null if there is none
	 */
	public Template getDynamicTemplate(String name) {
		for (Template template : templates) {
			if (template.isDynamic() && template.getName().equals(name)) {
				return template;
			}
		}
		return null;
	}

	public Expression getBeforeUpdate() {
		return beforeUpdate;
	}

	public void setBeforeUpdate(Expression beforeUpdate) {
		this.beforeUpdate = beforeUpdate;
	}

	public Expression getAfterUpdate() {
		return afterUpdate;
	}

	public void setAfterUpdate(Expression afterUpdate) {
		this.afterUpdate = afterUpdate;
	}

	public IssueContext getIssueContext() {
		return issues;
	}

	public TopLevelIssueContext getIssues() {
		return issues;
	}

	public boolean hasErrors() {
		return issues.hasErrors();
	}

	public boolean hasWarnings() {
		return issues.hasWarnings();
	}

	public void recordStopWatch() {
		logger.fine("system uses stopwatches");
		hasStopWatch = true;
	}

	public boolean hasStopWatch() {
		return hasStopWatch;
	}

	public void recordStrictInvariant() {
		hasStrictInvariants = true;
	}

	public boolean hasStrictInvariants() {
		return hasStrictInvariants;
	}

	public void recordStrictLowerBoundOnControllableEdges() {
		hasStrictLowerBoundOnControllableEdges = true;
	}

	public boolean hasStrictLowerBoundOnControllableEdges() {
		return hasStrictLowerBoundOnControllableEdges;
	}

	public void recordStrictBound() {
		hasStrictBound = true;
	}

	public boolean hasStrictBound() {
		return hasStrictBound;
	}

	public void setUrgentTransition() {
		hasUrgentTransition = true;
	}

	public boolean hasUrgentTransition() {
		return hasUrgentTransition;
	}

	public void clockGuardRecvBroadcast() {
		hasClockGuardRecvBroadcast = true;
	}

	public boolean hasClockGuardRecvBroadcast() {
		return hasClockGuardRecvBroadcast;
	}

	public void setSyncUsed(SyncUsage syncUsed) {
		this.syncUsed = syncUsed;
	}

	public SyncUsage getSyncUsed() {
		return syncUsed;
	}

	/**
	 * Visits the global declarations, every template and its contents, every template again as an
	 * instance of itself, the partial instances, the processes and finally the properties.
	 */
	public void accept(SystemVisitor v) {
		if (v.visitSystemBefore(this)) {
			globals.accept(v);
			for (Template template : templates) {
				template.accept(v);
			}
			for (Template template : templates) {
				v.visitInstance(template);
			}
			for (Instance instance : instances) {
				v.visitInstance(instance);
			}
			for (Instance process : processes) {
				v.visitProcess(process);
			}
			for (Expression query : queries) {
				v.visitProperty(query);
			}
		}
		v.visitSystemAfter(this);
	}

}
