package lite.trans.passes.blocks;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import lite.errors.TopLevelIssueContext;
import lite.lexer.TokenArena;

@RunWith(Parameterized.class)
public class ControlBlockNormalisingPassTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
			{ "if(x > 1)\n  a()\nelse\n  b()", "if(x > 1) {\n  a()\n}\nelse {\n  b()\n}" },
			{ "while(i < 3)\n  i++", "while(i < 3) {\n  i++\n}" },
			{ "if(a)\n  x()\nelse if(b)\n  y()", "if(a) {\n  x()\n}\nelse if(b) {\n  y()\n}" },
			{ "if(a) {\n  x()\n}", "if(a) {\n  x()\n}" },
			{ "if(a) // check\n  x()", "if(a) { // check\n  x()\n}" },
			{ "if(a)\nb()", "if(a) {\n}\nb()" },
			{ "function f(a) {\n  if(a)\n    g()\n}", "function f(a) {\n  if(a) {\n    g()\n  }\n}" },
			{ "if(a) b()", "if(a) b()" },
			{ "for(let i = 0; i < 3; i++)\n  log(i)", "for(let i = 0; i < 3; i++) {\n  log(i)\n}" },
			{
				"if(a)\n  if(b)\n    x()\n  else\n    y()\nz()",
				"if(a) {\n  if(b) {\n    x()\n  }\n  else {\n    y()\n  }\n}\nz()"
			},
			{ "do {\n  x()\n} while(x)", "do {\n  x()\n} while(x)" },
			{ "s = `\nif(a)\n`", "s = `\nif(a)\n`" },
		});
	}

	String input;
	String expected;

	public ControlBlockNormalisingPassTest(String input, String expected) {
		this.input = input;
		this.expected = expected;
	}

	@Test
	public void test() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		String actual = new ControlBlockNormalisingPass().perform(ctx, input);
		assertFalse(ctx.hasErrors());
		assertThat(actual, is(expected));
	}

	@Test
	public void testBlocksBalance() {
		String actual = new ControlBlockNormalisingPass().perform(new TopLevelIssueContext(), input);
		TokenArena arena = TokenArena.of(actual);
		for(int i = 0; i < arena.size(); i++) {
			if(arena.isBuiltin(i, "{") || arena.isBuiltin(i, "}")) {
				assertThat("unbalanced brace in " + actual, arena.partnerOf(i) == -1, is(false));
			}
		}
	}
}
