package tacheck;

public class InternalCompilerError extends RuntimeException {
	public InternalCompilerError() {
		super("internal type checker error");
	}

	public InternalCompilerError(String msg) {
		super("internal type checker error: " + msg);
	}

	public InternalCompilerError(Exception e) {
		super("internal type checker error", e);
	}
}
