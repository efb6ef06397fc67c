package lite;

import org.apache.commons.io.FileUtils;
import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

public class LiteOptions {
	public static final String VERSION = "0.1.0";

	@Option(value = "Version", aliases = {"-version"})
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = { "-help" })
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = { "-quiet" })
	public boolean quiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution ", aliases = { "-verbose" })
	public boolean verbose = false;

	@Option(value = "-w Re-run the script every time the source file changes", aliases = { "-watch" })
	public boolean watch = false;

	@Option(value = "-l Expand repeat, for-in, for-of and while loop sugar", aliases = { "-loops" })
	public boolean loops = false;

	@Option(value = "-p Print the generated JavaScript instead of running it", aliases = { "-print" })
	public boolean print = false;

	@Option(value = "-o Write the generated JavaScript to this file instead of running it", aliases = { "-output" })
	public String output;

	@Option(value = "-c path to the configuration file, if any", aliases = { "-config" })
	public String config;

	public String inputFilePath;

	// settings from the JSON configuration file, with command line overrides applied
	public LiteConfig settings = new LiteConfig();

	private final Options plumeOptions;
	private final String[] args;

	public void printHelp() {
		plumeOptions.printUsage();
	}

	public LiteOptions(String[] args) {
		plumeOptions = new Options("lite [options] <input.ls>", this);
		this.args = args;
	}

	/**
	 * @return whether the caller should stop after printing the version or the usage
	 */
	public boolean isInformational() {
		return version || help;
	}

	public void parse() throws LiteOptionException {
		String[] remainingArgs;
		try {
			remainingArgs = plumeOptions.parse(args);
		} catch (Options.ArgException e) {
			throw new LiteOptionException(e.getMessage());
		}

		if (isInformational()) {
			return;
		}

		if (remainingArgs.length != 1) {
			throw new LiteOptionException("expected exactly one input file, got " + remainingArgs.length);
		}

		inputFilePath = remainingArgs[0];

		if (quiet && verbose) {
			throw new LiteOptionException("-q and -v cannot be combined");
		}
		if (watch && (print || output != null)) {
			throw new LiteOptionException("-w runs the script on every change and cannot be combined with -p or -o");
		}

		if (config != null && !config.isEmpty()) {
			String s;

			try {
				s = FileUtils.readFileToString(new File(config), StandardCharsets.UTF_8);
			} catch (IOException ex) {
				throw new LiteOptionException("Error reading configuration file: " + ex.getMessage());
			}

			JSONObject json;

			try {
				json = new JSONObject(s);
			} catch (JSONException e) {
				throw new LiteOptionException(config + ": parsing error: " + e.getMessage());
			}

			settings = LiteConfig.fromJSON(json);
		}

		if (loops) {
			settings = settings.withLoopSugar(true);
		}
	}
}
