package lite.errors;

import lite.formatters.IndentingWriter;
import lite.formatters.IssueFormattingVisitor;
import lite.trans.LiteTransException;
import lite.util.SourceLocation;

/**
 * A problem found in the input. Passes report issues to an {@link IssueContext}; the scanners
 * they use throw them to abandon a match, and the pass catches and reports them.
 */
public abstract class Issue extends LiteTransException {

	private static final long serialVersionUID = 2875090362254781634L;

	protected Issue() {
		super("");
	}

	/**
	 * @return where the issue was found, in the buffer of the pass that found it
	 */
	public SourceLocation getLocation() {
		return SourceLocation.unknown();
	}

	/**
	 * @return the issue itself, without the contexts it was reported in
	 */
	public Issue unwrap() {
		return this;
	}

	public Issue withContext(Context ctx) {
		return new IssueWithContext(this, ctx);
	}

	@Override
	public String getMessage() {
		return IndentingWriter.render(out -> accept(new IssueFormattingVisitor(out)));
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}
