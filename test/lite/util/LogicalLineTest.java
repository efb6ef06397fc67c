package lite.util;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

import lite.lexer.TokenArena;

public class LogicalLineTest {

	@Test
	public void testSplitKeepsTrailingEmptyLine() {
		TokenArena arena = TokenArena.of("a\n\tb c\n");
		List<LogicalLine> lines = LogicalLine.split(arena);
		assertThat(lines.size(), is(3));

		assertThat(lines.get(0).getFirstToken(), is(0));
		assertThat(lines.get(0).getLastToken(), is(0));

		assertThat(lines.get(1).getIndentation(), is("\t"));
		assertThat(lines.get(1).getWidth(), is(1));
		assertThat(lines.get(1).getFirstToken(), is(1));
		assertThat(lines.get(1).getLastToken(), is(2));

		assertTrue(lines.get(2).isBlank());
		assertThat(lines.get(2).getText(), is(""));
	}

	@Test
	public void testCommentOnlyLineIsBlank() {
		List<LogicalLine> lines = LogicalLine.split(TokenArena.of("  // note\nx"));
		assertTrue(lines.get(0).isBlank());
		assertThat(lines.get(0).getWidth(), is(2));
		assertFalse(lines.get(1).isBlank());
	}

	@Test
	public void testLineInsideTemplateLiteralIsContinuation() {
		TokenArena arena = TokenArena.of("s = `a\n  b` + c\nd");
		List<LogicalLine> lines = LogicalLine.split(arena);
		assertFalse(lines.get(0).isContinuation());
		assertTrue(lines.get(1).isContinuation());
		assertFalse(lines.get(1).isBlank());
		assertThat(lines.get(1).getFirstToken(), is(-1));
		assertThat(lines.get(2).getFirstToken(), is(5));
	}

	@Test
	public void testLinesInsideSubstitutionAreContinuations() {
		// s = `${ xs . sum }` d
		TokenArena arena = TokenArena.of("s = `${\n  xs.sum\n}`\nd");
		List<LogicalLine> lines = LogicalLine.split(arena);
		assertThat(lines.size(), is(4));
		assertFalse(lines.get(0).isContinuation());
		assertThat(lines.get(0).getLastToken(), is(2));
		assertTrue(lines.get(1).isContinuation());
		assertTrue(lines.get(2).isContinuation());
		assertFalse(lines.get(3).isContinuation());
		assertThat(lines.get(3).getFirstToken(), is(7));
	}

	@Test
	public void testStartsWithToken() {
		TokenArena arena = TokenArena.of("  x = 1\n/* c */ y = 2");
		List<LogicalLine> lines = LogicalLine.split(arena);
		assertTrue(lines.get(0).startsWithToken(arena));
		assertFalse(lines.get(1).startsWithToken(arena));
	}

	@Test
	public void testTextAroundOffset() {
		TokenArena arena = TokenArena.of("ab\ncdef");
		LogicalLine line = LogicalLine.split(arena).get(1);
		assertThat(line.textBefore(5), is("cd"));
		assertThat(line.textFrom(5), is("ef"));
	}
}
