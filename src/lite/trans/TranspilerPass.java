package lite.trans;

import lite.errors.IssueContext;

/**
 * One whole-buffer rewrite stage of the transpiler.
 *
 * A pass must not keep state between calls: {@link #perform} may be called any number of
 * times, from any thread, each time with a fresh buffer.
 */
public interface TranspilerPass {

	/**
	 * @return a short human readable name, used in logs and issue reports
	 */
	String getName();

	/**
	 * @return the rewritten buffer; if issues were reported to ctx the returned text is
	 * the input, unchanged
	 */
	String perform(IssueContext ctx, String source);

}
