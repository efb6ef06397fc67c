package lite.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * A replacement of the characters between two offsets of a buffer.
 */
public class TextEdit {
	protected final int start;
	protected final int end;
	protected final String replacement;

	public TextEdit(int start, int end, String replacement) {
		if(start > end) {
			throw new IllegalArgumentException("edit ends before it starts: " + start + " > " + end);
		}
		this.start = start;
		this.end = end;
		this.replacement = replacement;
	}

	public static TextEdit insert(int offset, String text) {
		return new TextEdit(offset, offset, text);
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	public String getReplacement() {
		return replacement;
	}

	public boolean overlaps(TextEdit other) {
		return start < other.end && other.start < end;
	}

	/**
	 * Applies non-overlapping edits, rightmost first so earlier offsets stay valid.
	 */
	public static String apply(CharSequence text, Collection<? extends TextEdit> edits) {
		List<TextEdit> ordered = new ArrayList<>(edits);
		ordered.sort(Comparator.comparingInt(TextEdit::getStart).thenComparingInt(TextEdit::getEnd).reversed());
		StringBuilder result = new StringBuilder(text);
		TextEdit previous = null;
		for(TextEdit edit : ordered) {
			if(previous != null && edit.end > previous.start) {
				throw new IllegalArgumentException("overlapping edits at offsets " + edit.start + " and " + previous.start);
			}
			result.replace(edit.start, edit.end, edit.replacement);
			previous = edit;
		}
		return result.toString();
	}

	@Override
	public String toString() {
		return "TextEdit [start=" + start + ", end=" + end + ", replacement=" + replacement + "]";
	}
}
