package lite.trans.passes.sugar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import lite.errors.IssueContext;
import lite.lexer.LiteToken;
import lite.lexer.LiteTokenType;
import lite.lexer.TokenArena;
import lite.trans.TranspilerPass;
import lite.trans.passes.scan.Argument;
import lite.trans.passes.scan.ArgumentScanner;
import lite.trans.passes.scan.CallArguments;
import lite.trans.passes.scan.MalformedExpressionIssue;
import lite.trans.passes.scan.MatchCandidate;
import lite.trans.passes.scan.OperandScanner;
import lite.trans.passes.scan.UnbalancedDelimiterIssue;
import lite.util.TextEdit;

/**
 * Expands sugared collection operations until none are left.
 *
 * Each sweep re-lexes the buffer, collects every valid use of a rule and applies the
 * rightmost one together with every other use it does not overlap. An enclosing use waits
 * until its inner uses have been expanded, so nested sugar is rewritten innermost first and
 * the number of sweeps is bounded by the nesting depth.
 */
public class ExpressionSugarExpansionPass implements TranspilerPass {

	private static final Logger logger = Logger.getLogger("Lite Transpiler");

	private static final Set<String> ASSIGNMENT_OPERATORS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
			"=", "+=", "-=", "*=", "/=", "%=", "**=", "<<=", ">>=", ">>>=", "&=", "|=", "^=", "&&=", "||=",
			"??=", "++", "--")));

	private final int maxPasses;

	public ExpressionSugarExpansionPass(int maxPasses) {
		if(maxPasses < 1) {
			throw new IllegalArgumentException("maxPasses must be positive, got " + maxPasses);
		}
		this.maxPasses = maxPasses;
	}

	public int getMaxPasses() {
		return maxPasses;
	}

	@Override
	public String getName() {
		return "expression sugar expansion";
	}

	@Override
	public String perform(IssueContext ctx, String source) {
		String buffer = source;
		int pass = 0;
		try {
			while(true) {
				List<MatchCandidate> candidates = findCandidates(buffer);
				if(candidates.isEmpty()) {
					logger.fine("Expression sugar reached a fixed point after " + pass + " sweep(s)");
					return buffer;
				}
				if(pass == maxPasses) {
					List<MatchCandidate> pending = new ArrayList<>(candidates);
					pending.sort(MatchCandidate.RIGHTMOST_FIRST);
					ctx.error(new ExpansionDivergenceIssue(maxPasses, pending.size(), pending.get(0).getLocation()));
					return buffer;
				}
				buffer = TextEdit.apply(buffer, MatchCandidate.selectRightmostFirst(candidates));
				pass++;
			}
		} catch (UnbalancedDelimiterIssue | MalformedExpressionIssue issue) {
			ctx.error(issue);
			return buffer;
		}
	}

	/**
	 * @return every valid use of a rule in the buffer, each with its replacement computed
	 * @throws UnbalancedDelimiterIssue if a use has an argument list or operand that is not closed
	 * @throws MalformedExpressionIssue if a member-style use has nothing to apply to
	 */
	public static List<MatchCandidate> findCandidates(String buffer) {
		TokenArena arena = TokenArena.of(buffer);
		List<MatchCandidate> candidates = new ArrayList<>();
		for(int i = 0; i < arena.size(); i++) {
			LiteToken token = arena.get(i);
			if(token.getType() != LiteTokenType.IDENT || !ExpansionRules.isSugarName(token.getValue())) {
				continue;
			}
			boolean negated = arena.isBuiltin(i + 1, "!") && arena.adjacent(i, i + 1);
			String spelling = negated ? token.getValue() + "!" : token.getValue();
			int after = negated ? i + 2 : i + 1;
			boolean member = arena.isBuiltin(i - 1, ".") || arena.isBuiltin(i - 1, "?.");

			MatchCandidate candidate;
			if(member) {
				candidate = matchMember(arena, i, spelling, after);
			} else if(arena.isIdent(i - 1, "function")) {
				candidate = null;
			} else {
				candidate = matchStandalone(arena, i, spelling, after);
			}
			if(candidate != null) {
				candidates.add(candidate);
			}
		}
		return candidates;
	}

	private static MatchCandidate matchMember(TokenArena arena, int nameIndex, String spelling, int after) {
		ExpansionRule rule = ExpansionRules.find(spelling, CallShape.MEMBER);
		if(rule == null) {
			return null;
		}
		LiteToken name = arena.get(nameIndex);
		boolean followedByParen = arena.isBuiltin(after, "(");

		int end;
		List<String> operands = new ArrayList<>();
		List<Argument> arguments = Collections.emptyList();
		if(rule.takesArgumentList()) {
			if(!followedByParen) {
				return null;
			}
			CallArguments call = ArgumentScanner.scan(arena, after);
			if(!rule.acceptsArgumentCount(call.size())) {
				return null;
			}
			arguments = call.getArguments();
			end = arena.get(call.getCloseIndex()).getEndOffset();
		} else {
			// xs.sort() is the native call, obj.sum = 1 a property write
			if(followedByParen || (after < arena.size() && ASSIGNMENT_OPERATORS.contains(arena.get(after).getValue())
					&& arena.get(after).getType() == LiteTokenType.BUILTIN)) {
				return null;
			}
			end = arena.get(after - 1).getEndOffset();
		}
		if(!rule.getOperation().acceptsFunctionLiterals() && anyFunctionLiteral(arguments)) {
			return null;
		}

		int dot = nameIndex - 1;
		int operandStart = -1;
		// a line may open with .name to continue the chain above it
		if(dot > 0) {
			operandStart = OperandScanner.scanBackward(arena, dot - 1);
		}
		if(operandStart == -1) {
			throw new MalformedExpressionIssue(arena.get(dot).getLocation(), name.getValue());
		}
		operands.add(arena.textOf(operandStart, dot - 1));
		for(Argument argument : arguments) {
			operands.add(argument.getText());
		}
		int start = arena.get(operandStart).getStartOffset();
		return new MatchCandidate(spelling, name.getLocation(), start, end, rule.getOperation().expand(operands));
	}

	private static MatchCandidate matchStandalone(TokenArena arena, int nameIndex, String spelling, int after) {
		ExpansionRule rule = ExpansionRules.find(spelling, CallShape.STANDALONE);
		if(rule == null || !arena.isBuiltin(after, "(")) {
			return null;
		}
		CallArguments call = ArgumentScanner.scan(arena, after);
		if(!rule.acceptsArgumentCount(call.size())) {
			return null;
		}
		if(!rule.getOperation().acceptsFunctionLiterals() && anyFunctionLiteral(call.getArguments())) {
			return null;
		}
		LiteToken name = arena.get(nameIndex);
		int end = arena.get(call.getCloseIndex()).getEndOffset();
		return new MatchCandidate(spelling, name.getLocation(), name.getStartOffset(), end,
				rule.getOperation().expand(call.getTexts()));
	}

	private static boolean anyFunctionLiteral(List<Argument> arguments) {
		for(Argument argument : arguments) {
			if(argument.containsFunctionLiteral()) {
				return true;
			}
		}
		return false;
	}
}
