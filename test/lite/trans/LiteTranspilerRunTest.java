package lite.trans;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;
import static org.junit.Assume.assumeTrue;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import lite.LiteConfig;
import lite.LiteTestingUtils;
import lite.exec.NodeScriptExecutor;

// runs the transpiled fixtures with node and compares what they print
@RunWith(Parameterized.class)
public class LiteTranspilerRunTest {

	@Parameters(name = "{0}")
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
			{ "scenario-a", false },
			{ "scenario-b", false },
			{ "scenario-c", false },
			{ "scenario-d", false },
			{ "scenario-e", false },
			{ "scenario-f", false },
			{ "stats", false },
			{ "templates", false },
			{ "loops", true },
		});
	}

	private String name;
	private boolean loopSugar;

	public LiteTranspilerRunTest(String name, boolean loopSugar) {
		this.name = name;
		this.loopSugar = loopSugar;
	}

	@Before
	public void requireNode() {
		assumeTrue(LiteTestingUtils.isNodeAvailable());
	}

	@Test
	public void test() throws IOException {
		String script = LiteTranspiler.standard(LiteTranspiler.DEFAULT_MAX_PASSES, loopSugar)
				.transpile(LiteTestingUtils.readFixture(name + ".ls"));
		List<String> output = Collections.synchronizedList(new ArrayList<>());
		new NodeScriptExecutor(LiteConfig.DEFAULT_COMMAND).execute(name + ".ls", script, output::add);
		assertThat(LiteTestingUtils.rightTrimmed(output),
				is(LiteTestingUtils.rightTrimmed(LiteTestingUtils.readFixtureLines(name + ".out"))));
	}
}
