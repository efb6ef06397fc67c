package lite.util;

/**
 * A common abstract base for anything that should be traced back to the place in the
 * buffer it came from.
 */
public abstract class SourceLocatable {

	public abstract SourceLocation getLocation();

}
