package lite.lexer;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * JavaScript keywords that can never be a variable, a function name or the end of an
 * operand. Literal-like keywords such as this, null or true are deliberately absent.
 */
public final class ReservedWords {
	private ReservedWords() {}

	static final Set<String> RESERVED = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
			"async", "await", "break", "case", "catch", "class", "const", "continue", "debugger", "default",
			"delete", "do", "else", "export", "extends", "finally", "for", "function", "if", "import", "in",
			"instanceof", "let", "new", "of", "return", "static", "switch", "throw", "try", "typeof", "var",
			"void", "while", "with", "yield")));

	public static boolean isReserved(String word) {
		return RESERVED.contains(word);
	}

	public static boolean isReserved(LiteToken token) {
		return token.getType() == LiteTokenType.IDENT && RESERVED.contains(token.getValue());
	}
}
