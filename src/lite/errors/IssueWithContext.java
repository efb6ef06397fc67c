package lite.errors;

import lite.util.SourceLocation;

public class IssueWithContext extends Issue {

	private static final long serialVersionUID = -3906242512170935580L;

	private final Context context;
	private final Issue issue;

	public IssueWithContext(Issue issue, Context context) {
		this.issue = issue;
		this.context = context;
	}

	public Issue getIssue() {
		return issue;
	}

	public Context getContext() {
		return context;
	}

	@Override
	public SourceLocation getLocation() {
		return issue.getLocation();
	}

	@Override
	public Issue unwrap() {
		return issue.unwrap();
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
