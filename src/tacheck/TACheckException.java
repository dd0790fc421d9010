package tacheck;

/**
 * A tacheck exception consisting of a prefix (type of error) and a message
 *
 */
public abstract class TACheckException extends RuntimeException {
	private final String msg;
	private final String prefix;

	public TACheckException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}
}
