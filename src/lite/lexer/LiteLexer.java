package lite.lexer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lite.util.SourceLocation;

/**
 * A small JavaScript-flavoured lexer shared by every pass of the transpiler.
 *
 * It only has to be good enough to find identifiers, balance brackets and step over
 * strings and comments; it never rejects input. Characters it does not know become single
 * character BUILTIN tokens, and strings that are missing their closing quote are returned
 * as unterminated STRING tokens so that the pass that trips over them can report where.
 *
 * Template literals with substitutions are split around them: the text pieces become
 * TEMPLATE_HEAD, TEMPLATE_MIDDLE and TEMPLATE_TAIL tokens and the code inside each
 * <code>${...}</code> is lexed like any other code.
 *
 * Regular expression literals are not recognised; a quote or bracket inside one is lexed
 * as if it were code.
 */
public class LiteLexer {

	static final Pattern WHITESPACE = Pattern.compile("[ \\t\\r\\f\\u000B\\u00A0\\uFEFF]+");

	static final Pattern IDENT = Pattern.compile("[\\p{L}_$][\\p{L}\\p{N}_$]*");

	static final Pattern[] NUMBER = {
		Pattern.compile("0[xX][0-9a-fA-F_]+n?"),
		Pattern.compile("0[bB][01_]+n?"),
		Pattern.compile("0[oO][0-7_]+n?"),
		Pattern.compile("[0-9][0-9_]*(\\.[0-9]+)?([eE][+-]?[0-9]+)?n?"),
	};

	static final String[] BUILTIN = {
		// member access and spread; ".." only appears in loop headers
		".",
		"..",
		"...",
		"?.",
		// brackets
		"(",
		")",
		"[",
		"]",
		"{",
		"}",
		// separators
		",",
		";",
		":",
		"?",
		// arrows and comparison
		"=>",
		"==",
		"===",
		"!=",
		"!==",
		"<",
		">",
		"<=",
		">=",
		// assignment
		"=",
		"+=",
		"-=",
		"*=",
		"/=",
		"%=",
		"**=",
		"<<=",
		">>=",
		">>>=",
		"&=",
		"|=",
		"^=",
		"&&=",
		"||=",
		"??=",
		// arithmetic, bitwise and logical operators
		"+",
		"-",
		"*",
		"/",
		"%",
		"**",
		"++",
		"--",
		"<<",
		">>",
		">>>",
		"&",
		"|",
		"^",
		"~",
		"!",
		"&&",
		"||",
		"??",
	};

	CharSequence text;

	int pos;
	int line;
	int lineStart;

	// one entry per open ${ substitution: how many braces are open inside it
	Deque<Integer> substitutions = new ArrayDeque<>();
	// whether the last template piece read ended at a backtick or a ${
	boolean pieceClosed;

	public LiteLexer(CharSequence text) {
		this.text = text;
	}

	private LiteToken makeToken(LiteTokenType type, int start, int startLine, int startColumn, boolean terminated) {
		SourceLocation location = new SourceLocation(text, start, pos, startLine, line, startColumn, pos - lineStart);
		return new LiteToken(text.subSequence(start, pos).toString(), type, location, terminated);
	}

	private boolean lookingAt(Pattern pattern) {
		Matcher m = pattern.matcher(text);
		m.region(pos, text.length());
		if(m.lookingAt()) {
			pos = m.end();
			return true;
		}
		return false;
	}

	private boolean startsWith(String s) {
		if(pos + s.length() > text.length()) {
			return false;
		}
		for(int i = 0; i < s.length(); i++) {
			if(text.charAt(pos + i) != s.charAt(i)) {
				return false;
			}
		}
		return true;
	}

	// advances over one character, keeping track of line starts
	private void step() {
		if(text.charAt(pos) == '\n') {
			line++;
			lineStart = pos + 1;
		}
		pos++;
	}

	/**
	 * @return whether the string was closed
	 */
	private boolean readString(char quote) {
		step();
		while(pos < text.length()) {
			char c = text.charAt(pos);
			if(c == '\\' && pos + 1 < text.length()) {
				step();
				step();
			} else if(c == quote) {
				step();
				return true;
			} else if(c == '\n') {
				// ordinary strings cannot span lines
				return false;
			} else {
				step();
			}
		}
		return false;
	}

	/**
	 * Reads template text starting at the opening backtick, or at the brace closing a
	 * substitution, up to the closing backtick or the next substitution.
	 */
	private LiteTokenType readTemplatePiece() {
		boolean head = text.charAt(pos) == '`';
		pieceClosed = true;
		step();
		while(pos < text.length()) {
			char c = text.charAt(pos);
			if(c == '\\' && pos + 1 < text.length()) {
				step();
				step();
			} else if(c == '`') {
				step();
				return head ? LiteTokenType.STRING : LiteTokenType.TEMPLATE_TAIL;
			} else if(c == '$' && startsWith("${")) {
				step();
				step();
				substitutions.push(0);
				return head ? LiteTokenType.TEMPLATE_HEAD : LiteTokenType.TEMPLATE_MIDDLE;
			} else {
				step();
			}
		}
		pieceClosed = false;
		return head ? LiteTokenType.STRING : LiteTokenType.TEMPLATE_TAIL;
	}

	/**
	 * @return a list of tokens scanned from the text the lexer was given; comments and
	 * whitespace are dropped
	 */
	public List<LiteToken> readTokens() {
		List<LiteToken> tokens = new ArrayList<>();
		pos = 0;
		line = 0;
		lineStart = 0;
		substitutions.clear();
		while(pos < text.length()) {
			char c = text.charAt(pos);
			if(c == '\n') {
				step();
				continue;
			}
			if(lookingAt(WHITESPACE)) {
				continue;
			}
			if(startsWith("//")) {
				while(pos < text.length() && text.charAt(pos) != '\n') {
					pos++;
				}
				continue;
			}
			if(startsWith("/*")) {
				pos += 2;
				while(pos < text.length() && !startsWith("*/")) {
					step();
				}
				pos = Math.min(pos + 2, text.length());
				continue;
			}

			int start = pos;
			int startLine = line;
			int startColumn = pos - lineStart;
			if(c == '`' || (c == '}' && !substitutions.isEmpty() && substitutions.peek() == 0)) {
				if(c == '}') {
					substitutions.pop();
				}
				LiteTokenType type = readTemplatePiece();
				tokens.add(makeToken(type, start, startLine, startColumn, pieceClosed));
				continue;
			}
			if(c == '"' || c == '\'') {
				boolean terminated = readString(c);
				tokens.add(makeToken(LiteTokenType.STRING, start, startLine, startColumn, terminated));
				continue;
			}
			if(lookingAt(IDENT)) {
				tokens.add(makeToken(LiteTokenType.IDENT, start, startLine, startColumn, true));
				continue;
			}
			// try to match the biggest number we can
			int numberEnd = -1;
			for(Pattern numberPattern : NUMBER) {
				pos = start;
				if(lookingAt(numberPattern) && pos > numberEnd) {
					numberEnd = pos;
				}
			}
			pos = start;
			if(numberEnd != -1) {
				pos = numberEnd;
				tokens.add(makeToken(LiteTokenType.NUMBER, start, startLine, startColumn, true));
				continue;
			}
			// match the longest builtin we can
			String possibleBuiltin = null;
			for(String builtin : BUILTIN) {
				if(possibleBuiltin != null && builtin.length() <= possibleBuiltin.length()) {
					continue;
				}
				if(startsWith(builtin)) {
					possibleBuiltin = builtin;
				}
			}
			if(!substitutions.isEmpty() && ("{".equals(possibleBuiltin) || "}".equals(possibleBuiltin))) {
				substitutions.push(substitutions.pop() + ("{".equals(possibleBuiltin) ? 1 : -1));
			}
			pos += possibleBuiltin != null ? possibleBuiltin.length() : 1;
			tokens.add(makeToken(LiteTokenType.BUILTIN, start, startLine, startColumn, true));
		}
		return tokens;
	}

}
