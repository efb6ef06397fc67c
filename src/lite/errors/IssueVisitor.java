package lite.errors;

import lite.trans.passes.parse.option.IOErrorIssue;
import lite.trans.passes.parse.option.OptionParserIssue;
import lite.trans.passes.scan.MalformedExpressionIssue;
import lite.trans.passes.scan.UnbalancedDelimiterIssue;
import lite.trans.passes.sugar.ExpansionDivergenceIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
	public abstract T visit(UnbalancedDelimiterIssue unbalancedDelimiterIssue) throws E;
	public abstract T visit(MalformedExpressionIssue malformedExpressionIssue) throws E;
	public abstract T visit(ExpansionDivergenceIssue expansionDivergenceIssue) throws E;
}
