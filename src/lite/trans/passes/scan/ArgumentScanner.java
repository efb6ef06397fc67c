package lite.trans.passes.scan;

import java.util.ArrayList;
import java.util.List;

import lite.lexer.LiteToken;
import lite.lexer.LiteTokenType;
import lite.lexer.TokenArena;

/**
 * Splits the argument list of a call at its top-level commas.
 */
public final class ArgumentScanner {
	private ArgumentScanner() {}

	/**
	 * @param openIndex index of the opening parenthesis of the call
	 * @throws UnbalancedDelimiterIssue if the parenthesis, or any bracket or string inside
	 * the argument list, is not closed
	 */
	public static CallArguments scan(TokenArena arena, int openIndex) {
		int closeIndex = arena.partnerOf(openIndex);
		if(closeIndex == -1) {
			throw new UnbalancedDelimiterIssue(arena.get(openIndex));
		}
		for(int k = openIndex + 1; k < closeIndex; k++) {
			LiteToken token = arena.get(k);
			if((token.getType() == LiteTokenType.STRING || arena.isTemplatePiece(k)) && !token.isTerminated()) {
				throw new UnbalancedDelimiterIssue(token);
			}
			if(token.getType() == LiteTokenType.TEMPLATE_HEAD && arena.partnerOf(k) == -1) {
				throw new UnbalancedDelimiterIssue(token);
			}
			if((arena.isOpener(k) || arena.isCloser(k)) && arena.partnerOf(k) == -1) {
				throw new UnbalancedDelimiterIssue(token);
			}
		}
		List<Argument> arguments = new ArrayList<>();
		int argumentStart = openIndex + 1;
		int i = openIndex + 1;
		while(i < closeIndex) {
			LiteToken token = arena.get(i);
			if(arena.isOpener(i) || token.getType() == LiteTokenType.TEMPLATE_HEAD) {
				i = arena.partnerOf(i) + 1;
				continue;
			}
			if(token.isBuiltin(",")) {
				addArgument(arena, arguments, argumentStart, i - 1);
				argumentStart = i + 1;
			}
			i++;
		}
		addArgument(arena, arguments, argumentStart, closeIndex - 1);
		return new CallArguments(openIndex, closeIndex, arguments);
	}

	// empty slots, such as the one after a trailing comma, are not arguments
	private static void addArgument(TokenArena arena, List<Argument> arguments, int first, int last) {
		if(first <= last) {
			arguments.add(new Argument(arena, first, last));
		}
	}
}
