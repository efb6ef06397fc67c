package lite.trans.passes.scan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The parenthesised argument list of a call: where it opens and closes, and its arguments.
 */
public class CallArguments {
	private final int openIndex;
	private final int closeIndex;
	private final List<Argument> arguments;

	public CallArguments(int openIndex, int closeIndex, List<Argument> arguments) {
		this.openIndex = openIndex;
		this.closeIndex = closeIndex;
		this.arguments = Collections.unmodifiableList(arguments);
	}

	public int getOpenIndex() {
		return openIndex;
	}

	public int getCloseIndex() {
		return closeIndex;
	}

	public List<Argument> getArguments() {
		return arguments;
	}

	public int size() {
		return arguments.size();
	}

	public List<String> getTexts() {
		List<String> texts = new ArrayList<>();
		for(Argument argument : arguments) {
			texts.add(argument.getText());
		}
		return texts;
	}
}
