package lite.formatters;

import lite.errors.IssueVisitor;
import lite.errors.IssueWithContext;
import lite.trans.passes.parse.option.IOErrorIssue;
import lite.trans.passes.parse.option.OptionParserIssue;
import lite.trans.passes.scan.MalformedExpressionIssue;
import lite.trans.passes.scan.UnbalancedDelimiterIssue;
import lite.trans.passes.sugar.ExpansionDivergenceIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getMessage());
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO Error: ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

	@Override
	public Void visit(UnbalancedDelimiterIssue unbalancedDelimiterIssue) throws IOException {
		if(unbalancedDelimiterIssue.isUnterminatedString()) {
			out.write("unterminated string literal ");
		} else {
			out.write("unbalanced delimiter ");
			out.write(unbalancedDelimiterIssue.getDelimiter().getValue());
			out.write(" ");
		}
		unbalancedDelimiterIssue.getLocation().writePretty(out);
		return null;
	}

	@Override
	public Void visit(MalformedExpressionIssue malformedExpressionIssue) throws IOException {
		out.write("nothing to apply .");
		out.write(malformedExpressionIssue.getMember());
		out.write(" to ");
		malformedExpressionIssue.getLocation().writePretty(out);
		return null;
	}

	@Override
	public Void visit(ExpansionDivergenceIssue expansionDivergenceIssue) throws IOException {
		out.write("expressions still expandable after ");
		out.write(Integer.toString(expansionDivergenceIssue.getMaxPasses()));
		out.write(" pass(es), ");
		out.write(Integer.toString(expansionDivergenceIssue.getPendingCount()));
		out.write(" pending; the first is ");
		expansionDivergenceIssue.getLocation().writePretty(out);
		return null;
	}
}
