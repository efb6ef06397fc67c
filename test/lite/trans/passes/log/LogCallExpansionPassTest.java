package lite.trans.passes.log;

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
public class LogCallExpansionPassTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
			{ "log()", "console.log()" },
			{ "log(\"hi\")", "console.log(\"hi\")" },
			{ "log(total)", "console.log('total =>', total)" },
			{ "log(a, b)", "console.log('a =>', a, '\\nb =>', b)" },
			{ "log(\"total:\", t)", "console.log(\"total:\", t)" },
			{ "log(a + b)", "console.log('a + b =>', a + b)" },
			{ "log(m['k'])", "console.log('m[\\'k\\'] =>', m['k'])" },
			{ "log(log(a))", "console.log('console.log(\\'a =>\\', a) =>', console.log('a =>', a))" },
			{ "  log(x)\n  log(y)", "  console.log('x =>', x)\n  console.log('y =>', y)" },
			{ "log(`n=${len(xs)}`)", "console.log(`n=${len(xs)}`)" },
			{ "log(`${a}`, b)", "console.log(`${a}`, b)" },
			{ "log(`${a}` + b)", "console.log('`${a}` + b =>', `${a}` + b)" },
			{ "console.log(x)", "console.log(x)" },
			{ "obj.log(x)", "obj.log(x)" },
			{ "function log(x) {", "function log(x) {" },
			{ "logger(x)", "logger(x)" },
			{ "s = 'log(x)'", "s = 'log(x)'" },
		});
	}

	String input;
	String expected;

	public LogCallExpansionPassTest(String input, String expected) {
		this.input = input;
		this.expected = expected;
	}

	@Test
	public void test() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		String actual = new LogCallExpansionPass().perform(ctx, input);
		assertFalse(ctx.hasErrors());
		assertThat(actual, is(expected));
		assertThat(LogCallExpansionPass.findCandidates(actual).isEmpty(), is(true));
	}
}
