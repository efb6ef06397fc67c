package lite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import lite.trans.LiteTranspiler;

// Settings read from the JSON configuration file. Every field is optional:
//
// {
//   "transpile": { "max_passes": 100, "loop_sugar": false },
//   "execute":   { "command": ["node"] },
//   "watch":     { "interval_ms": 500 }
// }
//
// The command is run with the path of the generated script appended as its last argument.
public class LiteConfig {
	public static final String TRANSPILE_FIELD = "transpile";
	public static final String EXECUTE_FIELD = "execute";
	public static final String WATCH_FIELD = "watch";

	public static final List<String> DEFAULT_COMMAND = Collections.singletonList("node");
	public static final long DEFAULT_WATCH_INTERVAL_MS = 500;

	private final int maxPasses;
	private final boolean loopSugar;
	private final List<String> command;
	private final long watchIntervalMs;

	public LiteConfig() {
		this(LiteTranspiler.DEFAULT_MAX_PASSES, false, DEFAULT_COMMAND, DEFAULT_WATCH_INTERVAL_MS);
	}

	public LiteConfig(int maxPasses, boolean loopSugar, List<String> command, long watchIntervalMs) {
		this.maxPasses = maxPasses;
		this.loopSugar = loopSugar;
		this.command = Collections.unmodifiableList(new ArrayList<>(command));
		this.watchIntervalMs = watchIntervalMs;
	}

	public static LiteConfig fromJSON(JSONObject config) throws LiteOptionException {
		int maxPasses = LiteTranspiler.DEFAULT_MAX_PASSES;
		boolean loopSugar = false;
		List<String> command = DEFAULT_COMMAND;
		long watchIntervalMs = DEFAULT_WATCH_INTERVAL_MS;
		try {
			if (config.has(TRANSPILE_FIELD)) {
				JSONObject transpile = config.getJSONObject(TRANSPILE_FIELD);
				if (transpile.has("max_passes")) {
					maxPasses = transpile.getInt("max_passes");
					if (maxPasses < 1) {
						throw new LiteOptionException("transpile.max_passes must be positive, got " + maxPasses);
					}
				}
				if (transpile.has("loop_sugar")) {
					loopSugar = transpile.getBoolean("loop_sugar");
				}
			}

			if (config.has(EXECUTE_FIELD)) {
				JSONObject execute = config.getJSONObject(EXECUTE_FIELD);
				if (execute.has("command")) {
					JSONArray parts = execute.getJSONArray("command");
					if (parts.length() == 0) {
						throw new LiteOptionException("execute.command must not be empty");
					}
					command = new ArrayList<>();
					for (int i = 0; i < parts.length(); i++) {
						command.add(parts.getString(i));
					}
				}
			}

			if (config.has(WATCH_FIELD)) {
				JSONObject watch = config.getJSONObject(WATCH_FIELD);
				if (watch.has("interval_ms")) {
					watchIntervalMs = watch.getLong("interval_ms");
					if (watchIntervalMs < 1) {
						throw new LiteOptionException("watch.interval_ms must be positive, got " + watchIntervalMs);
					}
				}
			}
		} catch (JSONException e) {
			throw new LiteOptionException("invalid configuration: " + e.getMessage());
		}
		return new LiteConfig(maxPasses, loopSugar, command, watchIntervalMs);
	}

	public LiteConfig withLoopSugar(boolean loopSugar) {
		return new LiteConfig(maxPasses, loopSugar, command, watchIntervalMs);
	}

	public int getMaxPasses() {
		return maxPasses;
	}

	public boolean isLoopSugar() {
		return loopSugar;
	}

	public List<String> getCommand() {
		return command;
	}

	public long getWatchIntervalMs() {
		return watchIntervalMs;
	}
}
