package lite.exec;

import lite.LiteException;

/**
 * Exception raised when a generated script could not be started or exited with a failure.
 * Problems in the LiteScript source itself are reported as transpile issues instead.
 */
public class ScriptExecutionException extends LiteException {

	private static final long serialVersionUID = 4021730952177309614L;
	private static final String prefix = "Runtime Error";

	private final int exitCode;

	public ScriptExecutionException(String msg, int exitCode) {
		super(prefix, msg);
		this.exitCode = exitCode;
	}

	public ScriptExecutionException(String msg, Throwable cause) {
		super(prefix, msg, cause);
		this.exitCode = -1;
	}

	/**
	 * @return the exit status of the script, or -1 if it never ran to completion
	 */
	public int getExitCode() {
		return exitCode;
	}
}
