package lite.trans.passes.scan;

import lite.lexer.LiteTokenType;
import lite.lexer.TokenArena;

/**
 * One comma-separated argument of a call, as a range of tokens in a {@link TokenArena}.
 */
public class Argument {
	private final TokenArena arena;
	private final int first;
	private final int last;

	public Argument(TokenArena arena, int first, int last) {
		this.arena = arena;
		this.first = first;
		this.last = last;
	}

	public int getFirst() {
		return first;
	}

	public int getLast() {
		return last;
	}

	public String getText() {
		return arena.textOf(first, last);
	}

	/**
	 * @return whether the argument is exactly one closed string literal, in any quote style,
	 * or one template literal
	 */
	public boolean isStringLiteral() {
		if(arena.get(first).getType() == LiteTokenType.TEMPLATE_HEAD) {
			return arena.partnerOf(first) == last && arena.get(last).isTerminated();
		}
		return first == last
				&& arena.get(first).getType() == LiteTokenType.STRING
				&& arena.get(first).isTerminated();
	}

	/**
	 * @return whether an arrow or a function expression appears anywhere in the argument
	 */
	public boolean containsFunctionLiteral() {
		for(int i = first; i <= last; i++) {
			if(arena.isBuiltin(i, "=>") || arena.isIdent(i, "function")) {
				return true;
			}
		}
		return false;
	}

	@Override
	public String toString() {
		return getText();
	}
}
