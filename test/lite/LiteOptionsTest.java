package lite;

import static org.junit.Assert.*;

import java.util.Arrays;

import org.junit.Test;

import lite.trans.LiteTranspiler;

public class LiteOptionsTest {

	private static LiteOptions parse(String... args) throws LiteOptionException {
		LiteOptions opts = new LiteOptions(args);
		opts.parse();
		return opts;
	}

	@Test
	public void testInputOnly() throws LiteOptionException {
		LiteOptions opts = parse("in.ls");
		assertEquals("in.ls", opts.inputFilePath);
		assertFalse(opts.print);
		assertNull(opts.output);
		assertEquals(LiteTranspiler.DEFAULT_MAX_PASSES, opts.settings.getMaxPasses());
	}

	@Test
	public void testConfigFile() throws LiteOptionException {
		LiteOptions opts = parse("-c", "test/configs/full.json", "in.ls");
		assertEquals(10, opts.settings.getMaxPasses());
		assertTrue(opts.settings.isLoopSugar());
		assertEquals(Arrays.asList("node", "--no-warnings"), opts.settings.getCommand());
	}

	@Test
	public void testEmptyConfigFile() throws LiteOptionException {
		LiteOptions opts = parse("-c", "test/configs/empty.json", "in.ls");
		assertEquals(LiteConfig.DEFAULT_COMMAND, opts.settings.getCommand());
	}

	@Test
	public void testLoopsFlag() throws LiteOptionException {
		assertTrue(parse("-l", "in.ls").settings.isLoopSugar());
		assertFalse(parse("in.ls").settings.isLoopSugar());
	}

	@Test
	public void testOutputAndPrint() throws LiteOptionException {
		LiteOptions opts = parse("-p", "-o", "out.js", "in.ls");
		assertTrue(opts.print);
		assertEquals("out.js", opts.output);
	}

	@Test
	public void testVersionNeedsNoInput() throws LiteOptionException {
		LiteOptions opts = parse("--version");
		assertTrue(opts.isInformational());
		assertNull(opts.inputFilePath);
	}

	@Test(expected = LiteOptionException.class)
	public void testUnknownOption() throws LiteOptionException {
		parse("--bogus", "in.ls");
	}

	@Test
	public void testUnknownOptionMessageNamesIt() {
		try {
			parse("--bogus", "in.ls");
			fail("expected an option error");
		} catch (LiteOptionException e) {
			assertTrue(e.getMessage(), e.getMessage().contains("bogus"));
		}
	}

	@Test(expected = LiteOptionException.class)
	public void testMissingInput() throws LiteOptionException {
		parse("-p");
	}

	@Test(expected = LiteOptionException.class)
	public void testTwoInputs() throws LiteOptionException {
		parse("a.ls", "b.ls");
	}

	@Test(expected = LiteOptionException.class)
	public void testQuietAndVerbose() throws LiteOptionException {
		parse("-q", "-v", "in.ls");
	}

	@Test(expected = LiteOptionException.class)
	public void testWatchAndPrint() throws LiteOptionException {
		parse("-w", "-p", "in.ls");
	}

	@Test(expected = LiteOptionException.class)
	public void testBrokenConfigFile() throws LiteOptionException {
		parse("-c", "test/configs/broken.json", "in.ls");
	}

	@Test(expected = LiteOptionException.class)
	public void testMissingConfigFile() throws LiteOptionException {
		parse("-c", "test/configs/no-such-file.json", "in.ls");
	}
}
