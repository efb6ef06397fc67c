package lite.trans.passes.blocks;

import lite.lexer.LiteToken;
import lite.lexer.LiteTokenType;
import lite.lexer.ReservedWords;
import lite.lexer.TokenArena;
import lite.util.LogicalLine;

/**
 * Turns {@code name(params):} header lines into <code>function name(params) {</code> blocks.
 */
public class FunctionHeaderExpansionPass extends IndentationBlockPass {

	@Override
	public String getName() {
		return "function header expansion";
	}

	@Override
	protected String rewriteHeader(TokenArena arena, LogicalLine line) {
		if(!line.startsWithToken(arena)) {
			return null;
		}
		int first = line.getFirstToken();
		int last = line.getLastToken();
		LiteToken name = arena.get(first);
		if(name.getType() != LiteTokenType.IDENT || ReservedWords.isReserved(name) || !arena.isBuiltin(first + 1, "(")) {
			return null;
		}
		int close = arena.partnerOf(first + 1);
		if(close == -1 || close + 1 != last || !arena.isBuiltin(last, ":")) {
			return null;
		}
		String params = close == first + 2 ? "" : arena.textOf(first + 2, close - 1).trim();
		return line.getIndentation() + "function " + name.getValue() + "(" + params + ") {"
				+ line.textFrom(arena.get(last).getEndOffset());
	}
}
