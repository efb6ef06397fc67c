package lite.exec;

import java.util.function.Consumer;

public interface ScriptExecutor {
	/**
	 * Runs a generated script to completion.
	 *
	 * @param name a name for the script, used in file names and messages
	 * @param output receives every line the script prints, standard error included
	 * @throws ScriptExecutionException if the script cannot be run or fails
	 */
	void execute(String name, String script, Consumer<String> output);
}
