package lite.trans.passes.log;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

import lite.errors.TopLevelIssueContext;
import lite.trans.passes.scan.UnbalancedDelimiterIssue;

public class LogCallIssuesTest {

	@Test
	public void testUnclosedCall() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		String result = new LogCallExpansionPass().perform(ctx, "log(a");
		assertThat(ctx.getIssues().size(), is(1));
		assertThat(ctx.getIssues().get(0), instanceOf(UnbalancedDelimiterIssue.class));
		assertThat(result, is("log(a"));
	}

	@Test
	public void testLabelEscapes() {
		assertThat(LogCallExpansionPass.label("a\\b", false), is("'a\\\\b =>'"));
		assertThat(LogCallExpansionPass.label("`x\ny`", true), is("'\\n`x\\ny` =>'"));
	}
}
