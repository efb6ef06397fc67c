package lite.trans.passes.declaration;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import lite.errors.IssueContext;
import lite.lexer.LiteToken;
import lite.lexer.LiteTokenType;
import lite.lexer.ReservedWords;
import lite.lexer.TokenArena;
import lite.scope.DeclarationScope;
import lite.trans.TranspilerPass;
import lite.util.LogicalLine;
import lite.util.TextEdit;

/**
 * Declares variables on first assignment.
 *
 * {@code const} and {@code var} become {@code let}. A statement of the form
 * {@code name = value} at the start of a line gets a {@code let} the first time name is
 * assigned in the file, and loses any explicit keyword on later assignments.
 */
public class DeclarationInferencePass implements TranspilerPass {

	public static final String KEYWORD = "let";

	@Override
	public String getName() {
		return "declaration inference";
	}

	@Override
	public String perform(IssueContext ctx, String source) {
		return perform(source, new DeclarationScope());
	}

	/**
	 * @param scope receives every identifier this call declares
	 */
	public String perform(String source, DeclarationScope scope) {
		TokenArena arena = TokenArena.of(source);
		List<TextEdit> edits = new ArrayList<>();
		Set<Integer> handledKeywords = new HashSet<>();

		for(LogicalLine line : LogicalLine.split(arena)) {
			if(!line.startsWithToken(arena)) {
				continue;
			}
			int first = line.getFirstToken();
			int target = first;
			boolean explicit = isDeclarationKeyword(arena, first);
			if(explicit) {
				target = first + 1;
			}
			if(!isAssignmentTarget(arena, target)) {
				continue;
			}
			String name = arena.get(target).getValue();
			boolean fresh = scope.declare(name);
			int keywordStart = arena.get(first).getStartOffset();
			int targetStart = arena.get(target).getStartOffset();
			if(explicit) {
				handledKeywords.add(first);
				edits.add(new TextEdit(keywordStart, targetStart, fresh ? KEYWORD + " " : ""));
			} else if(fresh) {
				edits.add(TextEdit.insert(targetStart, KEYWORD + " "));
			}
		}

		for(int i = 0; i < arena.size(); i++) {
			if(handledKeywords.contains(i)) {
				continue;
			}
			LiteToken token = arena.get(i);
			boolean legacy = token.isIdent("const") || token.isIdent("var");
			// obj.var, { var: 1 } and { const() {} } use the word as a property name
			boolean property = arena.isBuiltin(i - 1, ".") || arena.isBuiltin(i - 1, "?.")
					|| arena.isBuiltin(i + 1, ":") || arena.isBuiltin(i + 1, "(");
			if(legacy && !property) {
				edits.add(new TextEdit(token.getStartOffset(), token.getEndOffset(), KEYWORD));
			}
		}

		return TextEdit.apply(source, edits);
	}

	private static boolean isDeclarationKeyword(TokenArena arena, int index) {
		LiteToken token = arena.get(index);
		return token.isIdent("let") || token.isIdent("const") || token.isIdent("var");
	}

	// name followed by a plain "=" on the same line
	private static boolean isAssignmentTarget(TokenArena arena, int index) {
		if(index + 1 >= arena.size() || !arena.sameLine(index, index + 1)) {
			return false;
		}
		LiteToken token = arena.get(index);
		return token.getType() == LiteTokenType.IDENT
				&& !ReservedWords.isReserved(token)
				&& arena.isBuiltin(index + 1, "=");
	}
}
