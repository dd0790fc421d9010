package tacheck.model.expr;

/**
 * The direction of a synchronisation label on an edge.
 */
public enum Synchronisation {
	// c!
	BANG,
	// c?
	QUE,
	// c, as used by CSP-style synchronisation
	CSP
}
