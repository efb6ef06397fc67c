package lite;

import org.apache.commons.io.FileUtils;
import lite.errors.IssueContext;
import lite.errors.TopLevelIssueContext;
import lite.exec.NodeScriptExecutor;
import lite.exec.ScriptExecutionException;
import lite.exec.ScriptExecutor;
import lite.trans.LiteTransException;
import lite.trans.LiteTranspiler;
import lite.trans.WhileTranspilingFile;
import lite.trans.passes.parse.option.IOErrorIssue;
import lite.trans.passes.parse.option.OptionParsingPass;
import lite.watch.SourceWatcher;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Logger;

public class LiteMain {
	private String[] cmdArgs;
	private static Logger logger;

	public LiteMain(String[] args) {
		cmdArgs = args;
		// Get the top Logger instance
		logger = Logger.getLogger("LiteMain");
	}

	// Creates a LiteMain instance, and initiates run() below.
	public static void main(String[] args) {
		if (new LiteMain(args).run()) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
			System.exit(1);
		}
	}

	/**
	 * Reads and transpiles one source file.
	 *
	 * @throws LiteTransException listing the issues found, if the file could not be read or
	 * transpiled
	 */
	static String transpileFile(LiteTranspiler transpiler, Path inputFilePath) throws LiteTransException {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		IssueContext fileCtx = ctx.withContext(new WhileTranspilingFile(inputFilePath));
		String source;
		try {
			source = FileUtils.readFileToString(inputFilePath.toFile(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			fileCtx.error(new IOErrorIssue(e));
			throw new LiteTransException(ctx.format());
		}
		String result = transpiler.transpile(fileCtx, source);
		checkErrors(ctx);
		return result;
	}

	private void cycle(LiteOptions opts, LiteTranspiler transpiler, ScriptExecutor executor, Path inputFilePath)
			throws IOException {
		logger.info("Transpiling " + inputFilePath);
		String script = transpileFile(transpiler, inputFilePath);

		if (opts.print) {
			System.out.println(script);
		}
		if (opts.output != null) {
			logger.info("Writing JavaScript to \"" + opts.output + "\"");
			FileUtils.writeStringToFile(new File(opts.output), script, StandardCharsets.UTF_8);
		}
		if (!opts.print && opts.output == null) {
			logger.info("Running " + inputFilePath.getFileName());
			executor.execute(inputFilePath.getFileName().toString(), script, System.out::println);
		}
	}

	private boolean watch(LiteOptions opts, LiteTranspiler transpiler, ScriptExecutor executor, Path inputFilePath) {
		Runnable cycle = () -> {
			try {
				cycle(opts, transpiler, executor, inputFilePath);
			} catch (LiteTransException | ScriptExecutionException e) {
				// the next change gets another chance
				logger.warning(e.getMessage());
			} catch (IOException e) {
				logger.warning("IO Error: " + e);
			}
		};
		CountDownLatch stopped = new CountDownLatch(1);
		try (SourceWatcher watcher = new SourceWatcher(inputFilePath, opts.settings.getWatchIntervalMs(), cycle)) {
			Runtime.getRuntime().addShutdownHook(new Thread(stopped::countDown));
			watcher.start();
			stopped.await();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		} catch (Exception e) {
			logger.severe("could not watch " + inputFilePath + ": " + e.getMessage());
			return false;
		}
		return true;
	}

	// Top-level workhorse method.
	public boolean run() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();

		// Check options, set up logging.
		LiteOptions opts = OptionParsingPass.perform(ctx, Logger.getLogger(""), cmdArgs);
		if (ctx.hasErrors()) {
			System.err.println(ctx.format());
			opts.printHelp();
			return false;
		}
		if (opts.version) {
			System.out.println("LiteScript version " + LiteOptions.VERSION);
			return true;
		}
		if (opts.help) {
			opts.printHelp();
			return true;
		}

		Path inputFilePath = Paths.get(opts.inputFilePath);
		LiteTranspiler transpiler = LiteTranspiler.standard(opts.settings.getMaxPasses(), opts.settings.isLoopSugar());
		ScriptExecutor executor = new NodeScriptExecutor(opts.settings.getCommand());

		if (opts.watch) {
			return watch(opts, transpiler, executor, inputFilePath);
		}

		try {
			cycle(opts, transpiler, executor, inputFilePath);
		} catch (LiteTransException e) {
			logger.severe("found issues");
			System.err.println(e.getMsg());
			return false;
		} catch (ScriptExecutionException e) {
			logger.severe(e.getMessage());
			return false;
		} catch (IOException e) {
			logger.severe("IO Error: " + e);
			return false;
		}

		return true;
	}

	private static void checkErrors(TopLevelIssueContext ctx) throws LiteTransException {
		if (ctx.hasErrors()) {
			throw new LiteTransException(ctx.format());
		}
	}
}
