package lite.trans;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

import lite.errors.IssueContext;
import lite.errors.TopLevelIssueContext;
import lite.trans.passes.blocks.ControlBlockNormalisingPass;
import lite.trans.passes.blocks.FunctionHeaderExpansionPass;
import lite.trans.passes.declaration.DeclarationInferencePass;
import lite.trans.passes.log.LogCallExpansionPass;
import lite.trans.passes.loops.LoopSugarExpansionPass;
import lite.trans.passes.sugar.ExpressionSugarExpansionPass;

/**
 * Turns LiteScript source into JavaScript by threading the text through an ordered list
 * of passes.
 *
 * Instances are immutable and hold no per-call state, so one transpiler can serve any
 * number of concurrent calls.
 */
public class LiteTranspiler {

	public static final int DEFAULT_MAX_PASSES = 100;

	private static final Logger logger = Logger.getLogger("Lite Transpiler");

	private final List<TranspilerPass> passes;

	public LiteTranspiler(List<TranspilerPass> passes) {
		this.passes = Collections.unmodifiableList(new ArrayList<>(passes));
	}

	/**
	 * The standard pipeline: declarations, function headers, control blocks, expression
	 * sugar, log calls.
	 */
	public static LiteTranspiler standard() {
		return standard(DEFAULT_MAX_PASSES, false);
	}

	/**
	 * @param maxPasses how many sweeps the expression sugar expansion may take
	 * @param loopSugar whether to rewrite repeat/for-in/for-of/while loop headers
	 */
	public static LiteTranspiler standard(int maxPasses, boolean loopSugar) {
		List<TranspilerPass> passes = new ArrayList<>();
		passes.add(new DeclarationInferencePass());
		if(loopSugar) {
			passes.add(new LoopSugarExpansionPass());
		}
		passes.add(new FunctionHeaderExpansionPass());
		passes.add(new ControlBlockNormalisingPass());
		passes.add(new ExpressionSugarExpansionPass(maxPasses));
		passes.add(new LogCallExpansionPass());
		return new LiteTranspiler(passes);
	}

	public List<TranspilerPass> getPasses() {
		return passes;
	}

	/**
	 * @throws LiteTransException listing every issue found, if the source could not be
	 * transpiled
	 */
	public String transpile(String source) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		String result = transpile(ctx, source);
		if(ctx.hasErrors()) {
			throw new LiteTransException(ctx.format());
		}
		return result;
	}

	/**
	 * Runs the passes in order, stopping after the first pass that reports an issue.
	 *
	 * @return the transpiled text, or the output of the last successful pass if issues
	 * were reported to ctx
	 */
	public String transpile(IssueContext ctx, String source) {
		String buffer = source.replace("\r\n", "\n");
		for(TranspilerPass pass : passes) {
			logger.fine("Running pass: " + pass.getName());
			IssueContext passCtx = ctx.withContext(new WhileRunningPass(pass.getName()));
			String result = pass.perform(passCtx, buffer);
			if(ctx.hasErrors()) {
				logger.fine("Pass " + pass.getName() + " reported issues");
				return buffer;
			}
			buffer = result;
		}
		return buffer;
	}
}
