package lite.trans.passes.blocks;

import lite.lexer.TokenArena;
import lite.util.LogicalLine;

/**
 * Braces bare {@code if(...)}, {@code while(...)}, {@code for(...)}, {@code else} and
 * {@code else if(...)} headers. A header already ending in a brace is left alone.
 */
public class ControlBlockNormalisingPass extends IndentationBlockPass {

	@Override
	public String getName() {
		return "control block normalisation";
	}

	@Override
	protected String rewriteHeader(TokenArena arena, LogicalLine line) {
		if(!line.startsWithToken(arena)) {
			return null;
		}
		int first = line.getFirstToken();
		int last = line.getLastToken();
		boolean header;
		if(arena.isIdent(first, "else")) {
			header = first == last || arena.isIdent(first + 1, "if") && closesCondition(arena, first + 2, last);
		} else if(arena.isIdent(first, "if") || arena.isIdent(first, "while") || arena.isIdent(first, "for")) {
			header = closesCondition(arena, first + 1, last);
		} else {
			header = false;
		}
		if(!header) {
			return null;
		}
		int end = arena.get(last).getEndOffset();
		return line.textBefore(end) + " {" + line.textFrom(end);
	}

	// the parenthesis at open exists and its partner is the last token of the line
	private static boolean closesCondition(TokenArena arena, int open, int last) {
		return arena.isBuiltin(open, "(") && arena.partnerOf(open) == last;
	}
}
