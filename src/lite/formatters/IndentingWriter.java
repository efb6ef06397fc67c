package lite.formatters;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * A {@link Writer} that prefixes every line it writes with the current indentation.
 * Issue reports use it to nest the context of an issue above the issue itself.
 */
public class IndentingWriter extends Writer {

	private static final int DEFAULT_INDENT = 4;

	private final Writer out;
	private int indent = 0;
	private boolean shouldIndent = false;

	public static class Indent implements AutoCloseable {

		private final IndentingWriter writer;
		private final int spaces;

		Indent(IndentingWriter writer, int spaces) {
			this.writer = writer;
			this.spaces = spaces;
		}

		@Override
		public void close() {
			writer.unindent(spaces);
		}

	}

	/**
	 * Writes part of a report.
	 */
	public interface Body {
		void writeTo(IndentingWriter out) throws IOException;
	}

	public IndentingWriter(Writer out) {
		this.out = out;
	}

	/**
	 * @return everything body writes, as a string
	 */
	public static String render(Body body) {
		StringWriter w = new StringWriter();
		try {
			body.writeTo(new IndentingWriter(w));
		} catch (IOException e) {
			throw new UncheckedIOException("writing to a string failed", e);
		}
		return w.toString();
	}

	public Indent indent(int spaces) {
		indent += spaces;
		return new Indent(this, spaces);
	}

	public Indent indent() {
		return indent(DEFAULT_INDENT);
	}

	public void unindent(int spaces) {
		if(spaces > indent) {
			throw new IllegalStateException("can't unindent below 0");
		}
		indent -= spaces;
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	// issue reports are compared in tests, so line breaks do not depend on the platform
	public void newLine() throws IOException {
		write("\n");
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		String data = String.valueOf(chars, offset, len);
		int start = 0;
		while(start < data.length()) {
			if(shouldIndent) {
				for(int i = 0; i < indent; ++i) {
					out.write(' ');
				}
				shouldIndent = false;
			}
			int next = data.indexOf('\n', start);
			if(next == -1) {
				out.write(data, start, data.length() - start);
				break;
			}
			out.write(data, start, next + 1 - start);
			start = next + 1;
			shouldIndent = true;
		}
	}

}
