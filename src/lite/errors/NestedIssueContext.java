package lite.errors;

// reports through the parent, wrapping each issue in this context
public class NestedIssueContext extends IssueContext {

	private final IssueContext parent;
	private final Context context;

	public NestedIssueContext(IssueContext parent, Context context) {
		this.parent = parent;
		this.context = context;
	}

	@Override
	public void error(Issue err) {
		parent.error(err.withContext(context));
	}

	@Override
	public boolean hasErrors() {
		return parent.hasErrors();
	}
}
