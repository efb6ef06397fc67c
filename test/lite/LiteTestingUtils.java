package lite;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.apache.commons.io.FileUtils;

public class LiteTestingUtils {
	private LiteTestingUtils() {}

	public static final Path SOURCES = Paths.get("test", "lite-sources");

	private static Boolean nodeAvailable;

	public static String readFixture(String fileName) throws IOException {
		return FileUtils.readFileToString(SOURCES.resolve(fileName).toFile(), StandardCharsets.UTF_8);
	}

	public static List<String> readFixtureLines(String fileName) throws IOException {
		return FileUtils.readLines(SOURCES.resolve(fileName).toFile(), StandardCharsets.UTF_8);
	}

	// trailing whitespace differs between engines and platforms
	public static List<String> rightTrimmed(List<String> lines) {
		List<String> result = new ArrayList<>();
		for (String line : lines) {
			result.add(line.replaceAll("\\s+$", ""));
		}
		while (!result.isEmpty() && result.get(result.size() - 1).isEmpty()) {
			result.remove(result.size() - 1);
		}
		return result;
	}

	public static synchronized boolean isNodeAvailable() {
		if (nodeAvailable == null) {
			try {
				Process p = new ProcessBuilder(Arrays.asList("node", "--version"))
						.redirectErrorStream(true)
						.redirectOutput(ProcessBuilder.Redirect.DISCARD)
						.start();
				nodeAvailable = p.waitFor(30, TimeUnit.SECONDS) && p.exitValue() == 0;
			} catch (IOException e) {
				nodeAvailable = false;
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				nodeAvailable = false;
			}
		}
		return nodeAvailable;
	}
}
