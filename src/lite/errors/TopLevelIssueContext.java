package lite.errors;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

import lite.formatters.IndentingWriter;
import lite.formatters.IssueFormattingVisitor;

/**
 * Collects every issue reported during one run, in the order they were reported.
 */
public class TopLevelIssueContext extends IssueContext {

	private static final Logger logger = Logger.getLogger("Lite Transpiler");

	private final List<Issue> errors = new ArrayList<>();

	@Override
	public void error(Issue err) {
		logger.fine("Issue reported: " + err.unwrap().getClass().getSimpleName());
		errors.add(err);
	}

	@Override
	public boolean hasErrors() {
		return !errors.isEmpty();
	}

	/**
	 * @return the reported issues, each wrapped in the contexts it was reported in
	 */
	public List<Issue> getIssues() {
		return Collections.unmodifiableList(errors);
	}

	public void format(IndentingWriter out) throws IOException {
		out.write("Detected ");
		out.write(Integer.toString(errors.size()));
		out.write(" issue(s):");
		for(Issue e : errors) {
			out.newLine();
			e.accept(new IssueFormattingVisitor(out));
		}
	}

	public String format() {
		return IndentingWriter.render(this::format);
	}
}
