package lite.trans.passes.blocks;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

import lite.errors.IssueContext;
import lite.lexer.TokenArena;
import lite.trans.TranspilerPass;
import lite.util.LogicalLine;

/**
 * Gives explicit braces to the blocks that indentation implies.
 *
 * Each header line recognised by {@link #rewriteHeader} is opened with a <code>{</code> and pushed
 * on a stack if the next non-blank line is indented deeper than the header. Every later
 * line pops the headers indented at least as far as itself, and each pop emits a <code>}</code>
 * line with the indentation of its header. A header whose next line is not deeper gets its
 * <code>}</code> immediately.
 *
 * Blank and comment-only lines do not close blocks; closing braces go before them.
 */
public abstract class IndentationBlockPass implements TranspilerPass {

	private static final Logger logger = Logger.getLogger("Lite Transpiler");

	static final String CLOSER = "}";

	private static class Opener {
		final int width;
		final String indentation;

		Opener(LogicalLine header) {
			this.width = header.getWidth();
			this.indentation = header.getIndentation();
		}
	}

	/**
	 * @return the line rewritten so that it ends in an opening brace, or null if the line is
	 * not a header this pass handles
	 */
	protected abstract String rewriteHeader(TokenArena arena, LogicalLine line);

	@Override
	public String perform(IssueContext ctx, String source) {
		TokenArena arena = TokenArena.of(source);
		List<LogicalLine> lines = LogicalLine.split(arena);
		List<String> output = new ArrayList<>();
		List<String> blanks = new ArrayList<>();
		Deque<Opener> open = new ArrayDeque<>();
		int blocks = 0;

		for(int i = 0; i < lines.size(); i++) {
			LogicalLine line = lines.get(i);
			if(line.isContinuation()) {
				output.add(line.getText());
				continue;
			}
			if(line.isBlank()) {
				blanks.add(line.getText());
				continue;
			}
			while(!open.isEmpty() && open.peek().width >= line.getWidth()) {
				output.add(open.pop().indentation + CLOSER);
			}
			output.addAll(blanks);
			blanks.clear();

			String header = rewriteHeader(arena, line);
			if(header == null) {
				output.add(line.getText());
				continue;
			}
			output.add(header);
			blocks++;
			LogicalLine next = nextSignificant(lines, i + 1);
			if(next != null && next.getWidth() > line.getWidth()) {
				open.push(new Opener(line));
			} else {
				output.add(line.getIndentation() + CLOSER);
			}
		}
		while(!open.isEmpty()) {
			output.add(open.pop().indentation + CLOSER);
		}
		output.addAll(blanks);

		logger.fine(getName() + ": " + blocks + " block(s) opened and closed");
		return String.join("\n", output);
	}

	private static LogicalLine nextSignificant(List<LogicalLine> lines, int from) {
		for(int i = from; i < lines.size(); i++) {
			LogicalLine line = lines.get(i);
			if(!line.isBlank() && !line.isContinuation()) {
				return line;
			}
		}
		return null;
	}
}
