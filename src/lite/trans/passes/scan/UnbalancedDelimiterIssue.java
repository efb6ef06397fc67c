package lite.trans.passes.scan;

import lite.errors.Issue;
import lite.errors.IssueVisitor;
import lite.lexer.LiteToken;
import lite.util.SourceLocation;

public class UnbalancedDelimiterIssue extends Issue {

	private final LiteToken delimiter;

	public UnbalancedDelimiterIssue(LiteToken delimiter) {
		this.delimiter = delimiter;
	}

	public LiteToken getDelimiter() {
		return delimiter;
	}

	@Override
	public SourceLocation getLocation() {
		return delimiter.getLocation();
	}

	public boolean isUnterminatedString() {
		switch(delimiter.getType()) {
			case STRING:
			case TEMPLATE_HEAD:
			case TEMPLATE_MIDDLE:
			case TEMPLATE_TAIL:
				return true;
			default:
				return false;
		}
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
