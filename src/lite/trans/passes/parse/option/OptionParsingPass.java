package lite.trans.passes.parse.option;

import lite.LiteOptionException;
import lite.LiteOptions;
import lite.errors.IssueContext;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	public static LiteOptions perform(IssueContext ctx, Logger logger, String[] args) {
		LiteOptions opts = new LiteOptions(args);
		try {
			opts.parse();
		} catch (LiteOptionException e) {
			ctx.error(new OptionParserIssue(e.getMessage()));
		}
		// set the logger's log level based on command line arguments
		if (opts.quiet) {
			logger.setLevel(Level.WARNING);
		} else if (opts.verbose) {
			logger.setLevel(Level.FINE);
		} else {
			logger.setLevel(Level.INFO);
		}
		// console handlers filter at INFO on their own
		for (Handler handler : logger.getHandlers()) {
			handler.setLevel(logger.getLevel());
		}
		return opts;
	}
}
