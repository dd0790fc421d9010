package tacheck.model.system;

/**
 * Which family of synchronisation a system uses. A system may not mix input/output
 * synchronisations with CSP style ones.
 */
public enum SyncUsage {
	UNUSED,
	IO,
	CSP,
}
