package lite.errors;

/**
 * Where passes report issues. Contexts nest: an issue reported to a nested context reaches
 * the top level wrapped in every context on the way.
 */
public abstract class IssueContext {

	public abstract void error(Issue err);

	/**
	 * @return whether any issue has been reported to the top-level context so far, through
	 * this context or any other
	 */
	public abstract boolean hasErrors();

	public IssueContext withContext(Context context) {
		return new NestedIssueContext(this, context);
	}
}
