package lite.trans.passes.parse.option;

import lite.errors.Issue;
import lite.errors.IssueVisitor;

import java.io.IOException;

public class IOErrorIssue extends Issue {

	IOException error;

	public IOErrorIssue(IOException e) {
		super();
		this.error = e;
	}

	public IOException getError() {
		return error;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
