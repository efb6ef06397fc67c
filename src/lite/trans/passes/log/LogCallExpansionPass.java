package lite.trans.passes.log;

import java.util.ArrayList;
import java.util.List;

import lite.errors.IssueContext;
import lite.lexer.LiteToken;
import lite.lexer.TokenArena;
import lite.trans.TranspilerPass;
import lite.trans.passes.scan.Argument;
import lite.trans.passes.scan.ArgumentScanner;
import lite.trans.passes.scan.CallArguments;
import lite.trans.passes.scan.MatchCandidate;
import lite.trans.passes.scan.UnbalancedDelimiterIssue;
import lite.util.TextEdit;

/**
 * Rewrites the debug print {@code log(...)} into {@code console.log(...)}, labelling every
 * argument that is not a string literal with its own source text.
 *
 * <pre>
 * log(total)       console.log('total =&gt;', total)
 * log(a, b)        console.log('a =&gt;', a, '\nb =&gt;', b)
 * log("x", a)      console.log("x", a)
 * </pre>
 */
public class LogCallExpansionPass implements TranspilerPass {

	public static final String CALL = "log";
	public static final String TARGET = "console.log";

	@Override
	public String getName() {
		return "log call expansion";
	}

	@Override
	public String perform(IssueContext ctx, String source) {
		String buffer = source;
		try {
			// a call nested in the arguments of another is expanded one sweep earlier
			List<MatchCandidate> candidates = findCandidates(buffer);
			while(!candidates.isEmpty()) {
				buffer = TextEdit.apply(buffer, MatchCandidate.selectRightmostFirst(candidates));
				candidates = findCandidates(buffer);
			}
		} catch (UnbalancedDelimiterIssue issue) {
			ctx.error(issue);
		}
		return buffer;
	}

	/**
	 * @throws UnbalancedDelimiterIssue if the argument list of a log call is not closed
	 */
	public static List<MatchCandidate> findCandidates(String buffer) {
		TokenArena arena = TokenArena.of(buffer);
		List<MatchCandidate> candidates = new ArrayList<>();
		for(int i = 0; i < arena.size(); i++) {
			if(!arena.isIdent(i, CALL) || !arena.isBuiltin(i + 1, "(")) {
				continue;
			}
			if(arena.isBuiltin(i - 1, ".") || arena.isBuiltin(i - 1, "?.") || arena.isIdent(i - 1, "function")) {
				continue;
			}
			LiteToken name = arena.get(i);
			CallArguments call = ArgumentScanner.scan(arena, i + 1);
			int end = arena.get(call.getCloseIndex()).getEndOffset();
			candidates.add(new MatchCandidate(CALL, name.getLocation(), name.getStartOffset(), end,
					TARGET + "(" + formatArguments(call.getArguments()) + ")"));
		}
		return candidates;
	}

	static String formatArguments(List<Argument> arguments) {
		boolean anyLiteral = false;
		for(Argument argument : arguments) {
			anyLiteral |= argument.isStringLiteral();
		}
		StringBuilder result = new StringBuilder();
		if(anyLiteral) {
			for(Argument argument : arguments) {
				if(result.length() > 0) {
					result.append(", ");
				}
				result.append(argument.getText());
			}
			return result.toString();
		}
		boolean first = true;
		for(Argument argument : arguments) {
			if(!first) {
				result.append(", ");
			}
			result.append(label(argument.getText(), !first)).append(", ").append(argument.getText());
			first = false;
		}
		return result.toString();
	}

	// a single-quoted JavaScript string reading "<source> =>"
	static String label(String sourceText, boolean onNewLine) {
		StringBuilder label = new StringBuilder("'");
		if(onNewLine) {
			label.append("\\n");
		}
		for(int i = 0; i < sourceText.length(); i++) {
			char c = sourceText.charAt(i);
			switch(c) {
				case '\\':
					label.append("\\\\");
					break;
				case '\'':
					label.append("\\'");
					break;
				case '\n':
					label.append("\\n");
					break;
				case '\r':
					label.append("\\r");
					break;
				default:
					label.append(c);
			}
		}
		return label.append(" =>'").toString();
	}
}
