package lite.trans.passes.declaration;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import lite.errors.TopLevelIssueContext;

@RunWith(Parameterized.class)
public class DeclarationInferencePassTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
			{ "x = 1", "let x = 1" },
			{ "total = 0\ntotal = total + 5", "let total = 0\ntotal = total + 5" },
			{ "const a = 1\nvar b = 2", "let a = 1\nlet b = 2" },
			{ "let a = 1\na = 2\nlet a = 3", "let a = 1\na = 2\na = 3" },
			{ "obj.x = 1\narr[0] = 2", "obj.x = 1\narr[0] = 2" },
			{ "x == 1\ny += 2\nf = (a) => a", "x == 1\ny += 2\nlet f = (a) => a" },
			{ "  y = 1", "  let y = 1" },
			{ "s = `a\nb = 2`", "let s = `a\nb = 2`" },
			{ "o.const = 1", "o.const = 1" },
			{ "obj = { var: 1, const: 2 }", "let obj = { var: 1, const: 2 }" },
			{ "o = { const() { return 1 } }", "let o = { const() { return 1 } }" },
			{ "s = `${\nb = 2}`", "let s = `${\nb = 2}`" },
			{ "for (var i = 0; i < 3; i++)", "for (let i = 0; i < 3; i++)" },
			{ "// x = 1\nx = 2", "// x = 1\nlet x = 2" },
			{ "x = 1; y = 2", "let x = 1; y = 2" },
			{ "if = 1", "if = 1" },
			{ "f(x):\n  r = x * 2\n  return r\nr = 0", "f(x):\n  let r = x * 2\n  return r\nr = 0" },
		});
	}

	String input;
	String expected;

	public DeclarationInferencePassTest(String input, String expected) {
		this.input = input;
		this.expected = expected;
	}

	@Test
	public void test() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		String actual = new DeclarationInferencePass().perform(ctx, input);
		assertFalse(ctx.hasErrors());
		assertThat(actual, is(expected));
	}

	@Test
	public void testIdempotent() {
		DeclarationInferencePass pass = new DeclarationInferencePass();
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		String once = pass.perform(ctx, input);
		assertThat(pass.perform(ctx, once), is(once));
	}
}
