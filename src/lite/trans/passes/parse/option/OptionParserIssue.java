package lite.trans.passes.parse.option;

import lite.errors.Issue;
import lite.errors.IssueVisitor;

public class OptionParserIssue extends Issue {
	private String message;

	public OptionParserIssue(String message) {
		this.message = message;
	}

	@Override
	public String getMessage() {
		return message;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
