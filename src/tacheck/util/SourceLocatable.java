package tacheck.util;

/**
 *
 * A common abstract base, meant for model nodes (expressions, types, declarations),
 * that should be implemented by anything diagnostics can be reported against.
 *
 */
public abstract class SourceLocatable {

	public abstract SourceLocation getLocation();

}
