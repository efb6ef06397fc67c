package lite.trans.passes.loops;

import java.util.ArrayList;
import java.util.List;

import lite.errors.IssueContext;
import lite.lexer.LiteToken;
import lite.lexer.LiteTokenType;
import lite.lexer.ReservedWords;
import lite.lexer.TokenArena;
import lite.trans.TranspilerPass;
import lite.util.LogicalLine;
import lite.util.TextEdit;

/**
 * Rewrites parenthesis-free loop headers into JavaScript loop headers:
 *
 * <pre>
 * repeat n              for (let _ = 0; _ &lt; n; _++)
 * for i in a..b         for (let i = a; i &lt; b; i++)
 * for i in a..b..s      for (let i = a; i &lt; b; i += s)
 * for x of xs           for (let x of xs)
 * for k in obj          for (let k in obj)
 * while cond            while (cond)
 * </pre>
 *
 * Only the first statement of a line is considered. The rewritten headers are braced later
 * by {@link lite.trans.passes.blocks.ControlBlockNormalisingPass}.
 */
public class LoopSugarExpansionPass implements TranspilerPass {

	@Override
	public String getName() {
		return "loop sugar expansion";
	}

	@Override
	public String perform(IssueContext ctx, String source) {
		TokenArena arena = TokenArena.of(source);
		List<TextEdit> edits = new ArrayList<>();
		for(LogicalLine line : LogicalLine.split(arena)) {
			if(!line.startsWithToken(arena)) {
				continue;
			}
			int first = line.getFirstToken();
			int last = line.getLastToken();
			String header = null;
			if(arena.isIdent(first, "repeat") && first < last) {
				header = repeat(arena, first, last);
			} else if(arena.isIdent(first, "for") && first < last && !arena.isBuiltin(first + 1, "(")) {
				header = forLoop(arena, first, last);
			} else if(arena.isIdent(first, "while") && first < last && !arena.isBuiltin(first + 1, "(")) {
				header = "while (" + arena.textOf(first + 1, last) + ")";
			}
			if(header != null) {
				edits.add(new TextEdit(arena.get(first).getStartOffset(), arena.get(last).getEndOffset(), header));
			}
		}
		return TextEdit.apply(source, edits);
	}

	private static String repeat(TokenArena arena, int first, int last) {
		// "repeat = 3" and "repeat(3)" are ordinary code
		LiteToken next = arena.get(first + 1);
		if(next.getType() == LiteTokenType.BUILTIN && !arena.isOpener(first + 1)) {
			return null;
		}
		if(arena.isBuiltin(first + 1, "(") && arena.partnerOf(first + 1) == last) {
			return null;
		}
		return "for (let _ = 0; _ < " + arena.textOf(first + 1, last) + "; _++)";
	}

	private static String forLoop(TokenArena arena, int first, int last) {
		int variableEnd;
		if(arena.isBuiltin(first + 1, "[")) {
			variableEnd = arena.partnerOf(first + 1);
			if(variableEnd == -1) {
				return null;
			}
		} else if(arena.get(first + 1).getType() == LiteTokenType.IDENT && !ReservedWords.isReserved(arena.get(first + 1))) {
			variableEnd = first + 1;
		} else {
			return null;
		}
		int keyword = variableEnd + 1;
		if(keyword >= last) {
			return null;
		}
		String variable = arena.textOf(first + 1, variableEnd);
		String subject = arena.textOf(keyword + 1, last);
		if(arena.isIdent(keyword, "of")) {
			return "for (let " + variable + " of " + subject + ")";
		}
		if(!arena.isIdent(keyword, "in")) {
			return null;
		}
		List<String> bounds = splitRange(arena, keyword + 1, last);
		if(bounds.size() == 2 && variableEnd == first + 1) {
			return "for (let " + variable + " = " + bounds.get(0) + "; " + variable + " < " + bounds.get(1) + "; "
					+ variable + "++)";
		}
		if(bounds.size() == 3 && variableEnd == first + 1) {
			return "for (let " + variable + " = " + bounds.get(0) + "; " + variable + " < " + bounds.get(1) + "; "
					+ variable + " += " + bounds.get(2) + ")";
		}
		return "for (let " + variable + " in " + subject + ")";
	}

	// the parts of a..b or a..b..s, or a single part if the text is no range
	private static List<String> splitRange(TokenArena arena, int from, int to) {
		List<String> parts = new ArrayList<>();
		int partStart = from;
		int i = from;
		while(i <= to) {
			if(arena.isOpener(i) && arena.partnerOf(i) != -1) {
				i = arena.partnerOf(i) + 1;
				continue;
			}
			if(arena.isBuiltin(i, "..")) {
				if(i == partStart) {
					return new ArrayList<>();
				}
				parts.add(arena.textOf(partStart, i - 1));
				partStart = i + 1;
			}
			i++;
		}
		if(partStart > to) {
			return new ArrayList<>();
		}
		parts.add(arena.textOf(partStart, to));
		return parts;
	}
}
