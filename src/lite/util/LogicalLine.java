package lite.util;

import java.util.ArrayList;
import java.util.List;

import lite.lexer.LiteToken;
import lite.lexer.LiteTokenType;
import lite.lexer.TokenArena;

/**
 * One line of a buffer together with the tokens that start on it.
 *
 * The indentation width counts leading whitespace characters; a tab is one character like
 * a space. A line that starts inside a multi-line string, or inside a template literal, is
 * a continuation of the line the literal opened on, and carries no tokens of its own.
 */
public class LogicalLine {
	private final int number;
	private final String text;
	private final int startOffset;
	private final String indentation;
	private final int firstToken;
	private final int lastToken;
	private final boolean continuation;

	public LogicalLine(int number, String text, int startOffset, int firstToken, int lastToken,
	                   boolean continuation) {
		this.number = number;
		this.text = text;
		this.startOffset = startOffset;
		this.firstToken = firstToken;
		this.lastToken = lastToken;
		this.continuation = continuation;
		int width = 0;
		while(width < text.length() && (text.charAt(width) == ' ' || text.charAt(width) == '\t')) {
			width++;
		}
		this.indentation = text.substring(0, width);
	}

	/**
	 * Splits the arena's text at every {@code \n}. A buffer ending in a newline yields an
	 * empty last line, so joining the lines with {@code \n} gives the text back.
	 */
	public static List<LogicalLine> split(TokenArena arena) {
		String text = arena.getText().toString();
		List<LogicalLine> lines = new ArrayList<>();
		int token = 0;
		int lineStart = 0;
		int number = 0;
		int openTemplates = 0;
		while(true) {
			int lineEnd = text.indexOf('\n', lineStart);
			if(lineEnd == -1) {
				lineEnd = text.length();
			}
			// tokens never overlap, so only the last token before the line can still be open on it
			boolean continuation = openTemplates > 0;
			if(token > 0) {
				LiteToken previous = arena.get(token - 1);
				continuation |= (previous.getType() == LiteTokenType.STRING || arena.isTemplatePiece(token - 1))
						&& previous.getEndOffset() > lineStart;
			}
			int first = -1;
			int last = -1;
			while(token < arena.size() && arena.get(token).getStartOffset() < lineEnd) {
				if(first == -1) {
					first = token;
				}
				last = token;
				if(arena.partnerOf(token) != -1) {
					if(arena.get(token).getType() == LiteTokenType.TEMPLATE_HEAD) {
						openTemplates++;
					} else if(arena.get(token).getType() == LiteTokenType.TEMPLATE_TAIL) {
						openTemplates--;
					}
				}
				token++;
			}
			if(continuation) {
				first = -1;
				last = -1;
			}
			lines.add(new LogicalLine(number, text.substring(lineStart, lineEnd), lineStart, first, last, continuation));
			if(lineEnd == text.length()) {
				return lines;
			}
			lineStart = lineEnd + 1;
			number++;
		}
	}

	/**
	 * @return the line number, counting from 0
	 */
	public int getNumber() {
		return number;
	}

	/**
	 * @return the text of the line without its line break
	 */
	public String getText() {
		return text;
	}

	public int getStartOffset() {
		return startOffset;
	}

	public String getIndentation() {
		return indentation;
	}

	public int getWidth() {
		return indentation.length();
	}

	/**
	 * @return the index of the first token starting on this line, or -1 if there is none
	 */
	public int getFirstToken() {
		return firstToken;
	}

	public int getLastToken() {
		return lastToken;
	}

	public boolean isContinuation() {
		return continuation;
	}

	/**
	 * @return whether the line holds nothing but whitespace and comments
	 */
	public boolean isBlank() {
		return !continuation && firstToken == -1;
	}

	/**
	 * @return whether the first token of the line is also the first thing written on it, so
	 * the line does not open with a comment
	 */
	public boolean startsWithToken(TokenArena arena) {
		return firstToken != -1 && arena.get(firstToken).getStartOffset() == startOffset + getWidth();
	}

	/**
	 * @return the text of the line from the given absolute offset on
	 */
	public String textFrom(int offset) {
		return text.substring(offset - startOffset);
	}

	/**
	 * @return the text of the line up to the given absolute offset
	 */
	public String textBefore(int offset) {
		return text.substring(0, offset - startOffset);
	}

	@Override
	public String toString() {
		return "LogicalLine [number=" + number + ", text=" + text + "]";
	}
}
