package lite.trans.passes.scan;

import lite.errors.Issue;
import lite.errors.IssueVisitor;
import lite.util.SourceLocation;

public class MalformedExpressionIssue extends Issue {

	private final SourceLocation location;
	private final String member;

	public MalformedExpressionIssue(SourceLocation location, String member) {
		this.location = location;
		this.member = member;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	/**
	 * @return the member name that was missing its operand
	 */
	public String getMember() {
		return member;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
