package tacheck;

public class TypeCheckerOptionException extends TACheckException {
	private static final String prefix = "Configuration Error";

	public TypeCheckerOptionException(String msg) {
		super(prefix, msg);
	}
}
