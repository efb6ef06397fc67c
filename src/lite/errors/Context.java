package lite.errors;

/**
 * What was going on when an issue was reported, such as the file or the pass.
 */
public abstract class Context {

	public abstract <T, E extends Throwable> T accept(ContextVisitor<T, E> visitor) throws E;

}
