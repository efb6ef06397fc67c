package lite.trans.passes.scan;

import lite.lexer.LiteToken;
import lite.lexer.LiteTokenType;
import lite.lexer.ReservedWords;
import lite.lexer.TokenArena;

/**
 * Recovers the expression that a member access applies to by walking backwards over a
 * postfix chain: identifiers, literals, bracket groups and the {@code .}, {@code ?.},
 * call and index links between them.
 *
 * {@code [...xs].filter(v => v === 3)} is a single operand, as is {@code a.b[0](c)}.
 * The walk stops at operators, reserved words and line breaks outside brackets, except a
 * line break before a line that opens with {@code .} or {@code ?.}, which continues the chain.
 */
public final class OperandScanner {
	private OperandScanner() {}

	/**
	 * @param last index of the last token of the operand
	 * @return index of the first token of the operand, or -1 if the token at last
	 * cannot end an operand
	 * @throws UnbalancedDelimiterIssue if a closing bracket in the chain is unbalanced
	 * @throws MalformedExpressionIssue if a member access inside the chain has nothing on
	 * its left
	 */
	public static int scanBackward(TokenArena arena, int last) {
		int i = last;
		int start = -1;
		while(true) {
			int segmentStart = segmentStart(arena, i);
			if(segmentStart == -1) {
				if(start != -1) {
					// a link such as ".name" was followed back to something that is no operand
					LiteToken dot = arena.get(start - 1);
					throw new MalformedExpressionIssue(dot.getLocation(), arena.get(start).getValue());
				}
				return -1;
			}
			start = segmentStart;
			int prev = start - 1;
			if(prev < 0 || !arena.sameLine(prev, start)) {
				return start;
			}
			LiteToken link = arena.get(prev);
			if(link.isBuiltin(".") || link.isBuiltin("?.")) {
				if(prev - 1 < 0) {
					throw new MalformedExpressionIssue(link.getLocation(), arena.get(start).getValue());
				}
				i = prev - 1;
				continue;
			}
			boolean groupSuffix = arena.get(start).isBuiltin("(") || arena.get(start).isBuiltin("[");
			if(groupSuffix && canEndOperand(arena, prev)) {
				// a call or an index applied to what comes before
				i = prev;
				continue;
			}
			return start;
		}
	}

	/**
	 * @return whether the whole text is a single postfix chain, so that it can be used as
	 * the receiver of a member access without parentheses
	 */
	public static boolean isPostfixChain(String text) {
		TokenArena arena = TokenArena.of(text);
		if(arena.size() == 0) {
			return false;
		}
		try {
			return scanBackward(arena, arena.size() - 1) == 0;
		} catch (UnbalancedDelimiterIssue | MalformedExpressionIssue e) {
			return false;
		}
	}

	/**
	 * @return the text unchanged if it is a postfix chain, otherwise parenthesised
	 */
	public static String asReceiver(String text) {
		String trimmed = text.trim();
		return isPostfixChain(trimmed) ? trimmed : "(" + trimmed + ")";
	}

	private static boolean canEndOperand(TokenArena arena, int index) {
		LiteToken token = arena.get(index);
		switch(token.getType()) {
			case IDENT:
				return !ReservedWords.isReserved(token);
			case NUMBER:
				return true;
			case STRING:
				return token.isTerminated();
			case TEMPLATE_TAIL:
				return token.isTerminated() && arena.partnerOf(index) != -1;
			case BUILTIN:
				return arena.isCloser(index);
			default:
				return false;
		}
	}

	// the first token of the primary expression or bracket group that ends at index
	private static int segmentStart(TokenArena arena, int index) {
		LiteToken token = arena.get(index);
		if(arena.isCloser(index)) {
			int opener = arena.partnerOf(index);
			if(opener == -1) {
				throw new UnbalancedDelimiterIssue(token);
			}
			return opener;
		}
		if(token.getType() == LiteTokenType.STRING && !token.isTerminated()) {
			throw new UnbalancedDelimiterIssue(token);
		}
		if(token.getType() == LiteTokenType.TEMPLATE_TAIL) {
			if(!token.isTerminated() || arena.partnerOf(index) == -1) {
				throw new UnbalancedDelimiterIssue(token);
			}
			return arena.partnerOf(index);
		}
		return canEndOperand(arena, index) ? index : -1;
	}
}
