package lite.trans;

import lite.LiteException;

/**
 * Exception raised when LiteScript source cannot be turned into JavaScript
 *
 */
public class LiteTransException extends LiteException {

	private static final long serialVersionUID = -1752641749710219478L;
	private static final String prefix = "Transpile Error";

	public LiteTransException(String msg) {
		super(prefix, msg);
	}

}
