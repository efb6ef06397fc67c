package lite.lexer;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * The tokens of one buffer snapshot, stored once and addressed by index.
 *
 * On construction every bracket token is paired with its balancing partner, so passes can
 * jump over a whole {@code (...)}, {@code [...]} or {@code {...}} group in constant time.
 * A bracket that has no partner maps to -1; it is only an error if a pass needs to cross it.
 * Template literals are paired the same way, head with tail, and a bracket opened inside a
 * substitution never pairs with one outside it.
 */
public class TokenArena {

	private final CharSequence text;
	private final List<LiteToken> tokens;
	private final int[] partner;

	public TokenArena(CharSequence text, List<LiteToken> tokens) {
		this.text = text;
		this.tokens = Collections.unmodifiableList(tokens);
		this.partner = new int[tokens.size()];
		pairBrackets();
	}

	public static TokenArena of(CharSequence text) {
		return new TokenArena(text, new LiteLexer(text).readTokens());
	}

	private static String closerFor(String opener) {
		switch(opener) {
			case "(":
				return ")";
			case "[":
				return "]";
			case "{":
				return "}";
			default:
				return null;
		}
	}

	private void pairBrackets() {
		Deque<Integer> open = new ArrayDeque<>();
		// open template heads, with the bracket depth each one started at
		Deque<int[]> templates = new ArrayDeque<>();
		for(int i = 0; i < tokens.size(); i++) {
			partner[i] = -1;
			LiteTokenType type = tokens.get(i).getType();
			if(type == LiteTokenType.TEMPLATE_HEAD) {
				templates.push(new int[] {i, open.size()});
			} else if(type == LiteTokenType.TEMPLATE_MIDDLE || type == LiteTokenType.TEMPLATE_TAIL) {
				if(templates.isEmpty()) {
					continue;
				}
				while(open.size() > templates.peek()[1]) {
					open.pop();
				}
				if(type == LiteTokenType.TEMPLATE_TAIL) {
					int head = templates.pop()[0];
					partner[i] = head;
					partner[head] = i;
				}
			} else if(isOpener(i)) {
				open.push(i);
			} else if(isCloser(i)) {
				String closer = tokens.get(i).getValue();
				// a closer that matches an opener further down the stack abandons the openers above it
				int depth = 0;
				Iterator<Integer> it = open.iterator();
				int match = -1;
				while(it.hasNext()) {
					int candidate = it.next();
					if(closer.equals(closerFor(tokens.get(candidate).getValue()))) {
						match = candidate;
						break;
					}
					depth++;
				}
				if(match != -1) {
					for(int k = 0; k < depth; k++) {
						open.pop();
					}
					open.pop();
					partner[i] = match;
					partner[match] = i;
				}
			}
		}
	}

	public CharSequence getText() {
		return text;
	}

	public List<LiteToken> getTokens() {
		return tokens;
	}

	public int size() {
		return tokens.size();
	}

	public LiteToken get(int index) {
		return tokens.get(index);
	}

	/**
	 * @return whether the token is any piece of a template literal with substitutions
	 */
	public boolean isTemplatePiece(int index) {
		LiteTokenType type = tokens.get(index).getType();
		return type == LiteTokenType.TEMPLATE_HEAD || type == LiteTokenType.TEMPLATE_MIDDLE
				|| type == LiteTokenType.TEMPLATE_TAIL;
	}

	public boolean isOpener(int index) {
		LiteToken token = tokens.get(index);
		return token.getType() == LiteTokenType.BUILTIN && closerFor(token.getValue()) != null;
	}

	public boolean isCloser(int index) {
		LiteToken token = tokens.get(index);
		if(token.getType() != LiteTokenType.BUILTIN) {
			return false;
		}
		String value = token.getValue();
		return value.equals(")") || value.equals("]") || value.equals("}");
	}

	/**
	 * @return the index of the bracket or template piece balancing the one at index, or -1
	 * if it has none
	 */
	public int partnerOf(int index) {
		return partner[index];
	}

	/**
	 * @return whether the two tokens touch, with no whitespace or comment in between
	 */
	public boolean adjacent(int left, int right) {
		return tokens.get(left).getEndOffset() == tokens.get(right).getStartOffset();
	}

	/**
	 * @return whether the earlier token ends on the line the later one starts on
	 */
	public boolean sameLine(int earlier, int later) {
		return tokens.get(earlier).getLocation().getEndLine() == tokens.get(later).getLocation().getStartLine();
	}

	public boolean isBuiltin(int index, String value) {
		return index >= 0 && index < tokens.size() && tokens.get(index).isBuiltin(value);
	}

	public boolean isIdent(int index, String value) {
		return index >= 0 && index < tokens.size() && tokens.get(index).isIdent(value);
	}

	/**
	 * @return the source text spanning tokens first to last, inclusive
	 */
	public String textOf(int first, int last) {
		return text.subSequence(tokens.get(first).getStartOffset(), tokens.get(last).getEndOffset()).toString();
	}
}
