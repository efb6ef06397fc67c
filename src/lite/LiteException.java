package lite;

/**
 * A LiteScript exception consisting of a prefix (type of error) and a message
 */
public abstract class LiteException extends RuntimeException {
	private final String msg;
	private final String prefix;

	public LiteException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
	}

	public LiteException(String prefix, String msg, Throwable cause) {
		super(prefix + ": " + msg, cause);
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
