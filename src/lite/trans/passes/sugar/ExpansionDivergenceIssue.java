package lite.trans.passes.sugar;

import lite.errors.Issue;
import lite.errors.IssueVisitor;
import lite.util.SourceLocation;

public class ExpansionDivergenceIssue extends Issue {

	private final int maxPasses;
	private final int pendingCount;
	private final SourceLocation location;

	public ExpansionDivergenceIssue(int maxPasses, int pendingCount, SourceLocation location) {
		this.maxPasses = maxPasses;
		this.pendingCount = pendingCount;
		this.location = location;
	}

	public int getMaxPasses() {
		return maxPasses;
	}

	/**
	 * @return how many expansions were still possible when the passes ran out
	 */
	public int getPendingCount() {
		return pendingCount;
	}

	/**
	 * @return where the first pending expansion is, in the buffer of the last pass
	 */
	@Override
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
