package lite.util;

import lite.formatters.IndentingWriter;

import java.io.IOException;
import java.util.Objects;

/**
 * A span of the buffer a pass was working on. Offsets are 0-based character offsets,
 * lines and columns are 0-based and printed 1-based.
 *
 * The location keeps a reference to the buffer snapshot it was taken from, so an issue can
 * quote the offending line even though later passes would have rewritten it.
 */
public class SourceLocation implements Comparable<SourceLocation> {
	private final CharSequence source;
	private final int startOffset;
	private final int endOffset;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;

	public SourceLocation(CharSequence source, int startOffset, int endOffset, int startLine, int endLine,
	                      int startColumn, int endColumn) {
		this.source = source;
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	/**
	 * Computes line and column information for the given offsets by scanning the buffer.
	 */
	public static SourceLocation of(CharSequence source, int startOffset, int endOffset) {
		int line = 0;
		int lineStart = 0;
		int startLine = -1;
		int startColumn = -1;
		for(int pos = 0; pos <= endOffset && pos <= source.length(); pos++) {
			if(pos == startOffset) {
				startLine = line;
				startColumn = pos - lineStart;
			}
			if(pos == endOffset) {
				return new SourceLocation(source, startOffset, endOffset, startLine, line, startColumn,
						pos - lineStart);
			}
			if(pos < source.length() && source.charAt(pos) == '\n') {
				line++;
				lineStart = pos + 1;
			}
		}
		throw new IndexOutOfBoundsException("offset " + endOffset + " is past the end of the buffer");
	}

	public static SourceLocation unknown() {
		return new SourceLocation(null, -1, -1, -1, -1, -1, -1);
	}

	public boolean isUnknown() {
		return source == null;
	}

	public String prettyString() {
		return IndentingWriter.render(this::writePretty);
	}

	/**
	 * Writes the position, then the line it is on with the span underlined.
	 */
	public void writePretty(IndentingWriter out) throws IOException {
		if(isUnknown()) {
			out.write("at unknown source location");
			return;
		}
		out.write("at ");
		if(startLine != endLine) {
			out.write(""+(startLine+1)+":"+(startColumn+1)+"-"+(endLine+1)+":"+endColumn);
		} else if(startColumn != endColumn) {
			out.write(""+(startLine+1)+":"+(startColumn+1)+"-"+endColumn);
		} else {
			out.write(""+(startLine+1)+":"+(startColumn+1));
		}
		out.newLine();
		int lineStart = startOffset;
		while(lineStart > 0 && source.charAt(lineStart - 1) != '\n') {
			lineStart--;
		}
		int lineEnd = startOffset;
		while(lineEnd < source.length() && source.charAt(lineEnd) != '\n') {
			lineEnd++;
		}
		out.append(source, lineStart, lineEnd);
		out.newLine();
		for(int pos = lineStart; pos < startOffset; pos++) {
			out.append(source.charAt(pos) == '\t' ? '\t' : ' ');
		}
		int effectiveEnd = Math.max(Math.min(endOffset, lineEnd), startOffset + 1);
		for(int pos = startOffset; pos < effectiveEnd; pos++) {
			out.append('^');
		}
		if(startOffset == source.length()) {
			out.append(" EOF");
		}
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public int hashCode() {
		return Objects.hash(startOffset, endOffset, startLine, endLine, startColumn, endColumn);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		SourceLocation other = (SourceLocation) obj;
		return startOffset == other.startOffset && endOffset == other.endOffset
				&& startLine == other.startLine && endLine == other.endLine
				&& startColumn == other.startColumn && endColumn == other.endColumn;
	}

	@Override
	public int compareTo(SourceLocation o) {
		if(startOffset != o.startOffset) {
			return Integer.compare(startOffset, o.startOffset);
		}
		return Integer.compare(endOffset, o.endOffset);
	}

	@Override
	public String toString() {
		return "SourceLocation [startOffset=" + startOffset + ", endOffset=" + endOffset + ", startLine=" + startLine
				+ ", endLine=" + endLine + ", startColumn=" + startColumn + ", endColumn=" + endColumn + "]";
	}
}
