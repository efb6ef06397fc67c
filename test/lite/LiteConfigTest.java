package lite;

import static org.junit.Assert.*;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.apache.commons.io.IOUtils;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.Before;
import org.junit.Test;

import lite.trans.LiteTranspiler;

public class LiteConfigTest {

	// parsed JSON object for the configuration file used in the tests
	private JSONObject config;

	@Before
	public void setup() throws IOException {
		try (InputStream configIs = new FileInputStream("./test/configs/full.json")) {
			config = new JSONObject(IOUtils.toString(configIs, StandardCharsets.UTF_8));
		}
	}

	@Test
	public void testFullConfiguration() throws LiteOptionException {
		LiteConfig settings = LiteConfig.fromJSON(config);
		assertEquals(10, settings.getMaxPasses());
		assertTrue(settings.isLoopSugar());
		assertEquals(Arrays.asList("node", "--no-warnings"), settings.getCommand());
		assertEquals(250, settings.getWatchIntervalMs());
	}

	// every section is optional
	@Test
	public void testDefaults() throws LiteOptionException {
		LiteConfig settings = LiteConfig.fromJSON(new JSONObject());
		assertEquals(LiteTranspiler.DEFAULT_MAX_PASSES, settings.getMaxPasses());
		assertFalse(settings.isLoopSugar());
		assertEquals(LiteConfig.DEFAULT_COMMAND, settings.getCommand());
		assertEquals(LiteConfig.DEFAULT_WATCH_INTERVAL_MS, settings.getWatchIntervalMs());
	}

	@Test
	public void testMissingFieldsKeepDefaults() throws LiteOptionException {
		config.getJSONObject(LiteConfig.TRANSPILE_FIELD).remove("max_passes");
		config.remove(LiteConfig.EXECUTE_FIELD);
		LiteConfig settings = LiteConfig.fromJSON(config);
		assertEquals(LiteTranspiler.DEFAULT_MAX_PASSES, settings.getMaxPasses());
		assertEquals(LiteConfig.DEFAULT_COMMAND, settings.getCommand());
		assertTrue(settings.isLoopSugar());
	}

	@Test(expected = LiteOptionException.class)
	public void testNonPositiveMaxPasses() throws LiteOptionException {
		config.getJSONObject(LiteConfig.TRANSPILE_FIELD).put("max_passes", 0);
		LiteConfig.fromJSON(config);
	}

	@Test(expected = LiteOptionException.class)
	public void testEmptyCommand() throws LiteOptionException {
		config.getJSONObject(LiteConfig.EXECUTE_FIELD).put("command", new JSONArray());
		LiteConfig.fromJSON(config);
	}

	@Test(expected = LiteOptionException.class)
	public void testNonPositiveInterval() throws LiteOptionException {
		config.getJSONObject(LiteConfig.WATCH_FIELD).put("interval_ms", -5);
		LiteConfig.fromJSON(config);
	}

	// a section of the wrong type is reported as an option error, not a JSON exception
	@Test(expected = LiteOptionException.class)
	public void testWrongType() throws LiteOptionException {
		config.put(LiteConfig.TRANSPILE_FIELD, "fast");
		LiteConfig.fromJSON(config);
	}

	@Test
	public void testWithLoopSugar() throws LiteOptionException {
		LiteConfig settings = LiteConfig.fromJSON(config).withLoopSugar(false);
		assertFalse(settings.isLoopSugar());
		assertEquals(10, settings.getMaxPasses());
	}
}
