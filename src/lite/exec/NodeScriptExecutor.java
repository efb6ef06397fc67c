package lite.exec;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.logging.Logger;

import org.apache.commons.io.FileUtils;

/**
 * Runs scripts with an external JavaScript engine, {@code node} unless configured otherwise.
 * The script is written to a temporary file whose path is appended to the command.
 */
public class NodeScriptExecutor implements ScriptExecutor {

	private static final Logger logger = Logger.getLogger("LiteMain");

	private final List<String> command;

	public NodeScriptExecutor(List<String> command) {
		if (command.isEmpty()) {
			throw new IllegalArgumentException("empty command");
		}
		this.command = new ArrayList<>(command);
	}

	@Override
	public void execute(String name, String script, Consumer<String> output) {
		Path tempDir;
		try {
			tempDir = Files.createTempDirectory("lite");
		} catch (IOException e) {
			throw new ScriptExecutionException("could not create a directory for " + name, e);
		}
		try {
			Path scriptPath = tempDir.resolve(scriptFileName(name));
			FileUtils.writeStringToFile(scriptPath.toFile(), script, StandardCharsets.UTF_8);

			List<String> invocation = new ArrayList<>(command);
			invocation.add(scriptPath.toString());
			logger.fine("Running: " + String.join(" ", invocation));

			ProcessBuilder pb = new ProcessBuilder(invocation);
			pb.redirectErrorStream(true);
			Process p = pb.start();
			try (InputStream results = p.getInputStream();
			     InputStreamReader r = new InputStreamReader(results, StandardCharsets.UTF_8);
			     BufferedReader br = new BufferedReader(r)) {
				br.lines().forEach(output);
			}
			int exitCode = p.waitFor();
			if (exitCode != 0) {
				throw new ScriptExecutionException(name + " exited with status " + exitCode, exitCode);
			}
		} catch (IOException e) {
			throw new ScriptExecutionException("could not run " + name + " with " + command.get(0), e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ScriptExecutionException("interrupted while running " + name, e);
		} finally {
			expungeFile(tempDir.toFile());
		}
	}

	// a .ls source name becomes a .js script name
	static String scriptFileName(String name) {
		String base = new File(name).getName();
		if (base.endsWith(".ls")) {
			base = base.substring(0, base.length() - ".ls".length());
		}
		if (base.isEmpty()) {
			base = "script";
		}
		return base + ".js";
	}

	private static void expungeFile(File file) {
		if (!FileUtils.deleteQuietly(file)) {
			logger.warning("could not delete " + file + "; check your temp folder");
		}
	}
}
