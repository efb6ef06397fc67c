package lite.trans.passes.scan;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

import lite.lexer.TokenArena;

public class OperandScannerTest {

	// the operand that ends with the last token of the source
	private static String operandAtEnd(String source) {
		TokenArena arena = TokenArena.of(source);
		int start = OperandScanner.scanBackward(arena, arena.size() - 1);
		return start == -1 ? null : arena.textOf(start, arena.size() - 1);
	}

	@Test
	public void testIdentifier() {
		assertThat(operandAtEnd("x = xs"), is("xs"));
	}

	@Test
	public void testPostfixChain() {
		assertThat(operandAtEnd("return a.b[0](c)"), is("a.b[0](c)"));
		assertThat(operandAtEnd("y = [...xs].filter(v => v === 3)"), is("[...xs].filter(v => v === 3)"));
		assertThat(operandAtEnd("y = data?.items"), is("data?.items"));
	}

	@Test
	public void testStopsAtOperator() {
		assertThat(operandAtEnd("a + b"), is("b"));
		assertThat(operandAtEnd("!done"), is("done"));
	}

	@Test
	public void testStopsAtLineBreak() {
		assertThat(operandAtEnd("a\nb"), is("b"));
	}

	@Test
	public void testLeadingDotContinuesChain() {
		assertThat(operandAtEnd("t = xs\n    .items"), is("xs\n    .items"));
		assertThat(operandAtEnd("t = a\n  ?.b\n  .c"), is("a\n  ?.b\n  .c"));
	}

	@Test(expected = MalformedExpressionIssue.class)
	public void testLeadingDotAfterStatement() {
		operandAtEnd("x = 1;\n.b");
	}

	@Test
	public void testTemplateLiteral() {
		assertThat(operandAtEnd("x = `a${b}c`"), is("`a${b}c`"));
		assertThat(operandAtEnd("x = f(`${b}`)"), is("f(`${b}`)"));
	}

	@Test(expected = UnbalancedDelimiterIssue.class)
	public void testUnterminatedTemplateLiteral() {
		operandAtEnd("x = `a${b}c");
	}

	@Test
	public void testLiterals() {
		assertThat(operandAtEnd("x = 'abc'"), is("'abc'"));
		assertThat(operandAtEnd("x = 42"), is("42"));
		assertThat(operandAtEnd("x = (a + b)"), is("(a + b)"));
	}

	@Test
	public void testNoOperand() {
		assertThat(operandAtEnd("x ="), is(nullValue()));
		assertThat(operandAtEnd("return"), is(nullValue()));
	}

	@Test(expected = UnbalancedDelimiterIssue.class)
	public void testUnbalancedCloser() {
		operandAtEnd("x = a)");
	}

	@Test(expected = MalformedExpressionIssue.class)
	public void testDanglingMember() {
		operandAtEnd("x = .b");
	}

	@Test
	public void testAsReceiver() {
		assertThat(OperandScanner.asReceiver(" xs "), is("xs"));
		assertThat(OperandScanner.asReceiver("a.b(c)"), is("a.b(c)"));
		assertThat(OperandScanner.asReceiver("a + b"), is("(a + b)"));
		assertThat(OperandScanner.asReceiver("-1"), is("(-1)"));
		assertThat(OperandScanner.asReceiver("[1, 2]"), is("[1, 2]"));
	}
}
