package tacheck;

import static org.junit.Assert.*;

import org.apache.commons.io.IOUtils;
import org.json.JSONObject;
import org.junit.Before;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

public class TypeCheckerOptionsTest {

	private static final String CONFIG_PATH = "./examples/configs/typechecker.json";

	// parsed JSON object for the configuration file used in the tests
	private JSONObject config;

	@Before
	public void setup() throws IOException {
		try (FileInputStream configIs = new FileInputStream(CONFIG_PATH)) {
			config = new JSONObject(IOUtils.toString(configIs, StandardCharsets.UTF_8));
		}
	}

	// all advisories are off unless configured
	@Test
	public void testDefaults() {
		TypeCheckerOptions options = new TypeCheckerOptions();
		assertFalse(options.refinementWarnings);
		assertFalse(options.strictInvariantWarnings);
		assertFalse(options.targetInvariantWarnings);
	}

	// a configuration without a type checker section keeps the defaults
	@Test
	public void testNoTypeCheckerSection() {
		config.remove(TypeCheckerOptions.TYPECHECKER_FIELD);
		TypeCheckerOptions options = new TypeCheckerOptions(config);
		assertFalse(options.refinementWarnings);
		assertFalse(options.targetInvariantWarnings);
	}

	// missing switches default to false
	@Test
	public void testMissingSwitch() {
		getTypeChecker().remove(TypeCheckerOptions.REFINEMENT_WARNINGS_FIELD);
		TypeCheckerOptions options = new TypeCheckerOptions(config);
		assertFalse(options.refinementWarnings);
		assertTrue(options.targetInvariantWarnings);
	}

	// the type checker section must be an object
	@Test(expected = TypeCheckerOptionException.class)
	public void testTypeCheckerNotAnObject() {
		config.put(TypeCheckerOptions.TYPECHECKER_FIELD, 42);
		new TypeCheckerOptions(config);
	}

	@Test(expected = TypeCheckerOptionException.class)
	public void testMalformedJson() {
		TypeCheckerOptions.parse("{ \"typechecker\": ");
	}

	@Test
	public void testLoadFromStream() {
		String json = "{ \"typechecker\": { \"strict_invariant_warnings\": true } }";
		TypeCheckerOptions options = TypeCheckerOptions.load(
				new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
		assertTrue(options.strictInvariantWarnings);
		assertFalse(options.refinementWarnings);
	}

	// it works and parses the information correctly when the configuration file is well-formed
	@Test
	public void testWellFormedConfiguration() {
		TypeCheckerOptions options = TypeCheckerOptions.load(new File(CONFIG_PATH));
		assertTrue(options.refinementWarnings);
		assertFalse(options.strictInvariantWarnings);
		assertTrue(options.targetInvariantWarnings);
	}

	// errors reading a file name the file
	@Test
	public void testMissingFile() {
		try {
			TypeCheckerOptions.load(new File("./examples/configs/missing.json"));
			fail("expected a configuration error");
		} catch (TypeCheckerOptionException e) {
			assertTrue(e.getMsg().startsWith("Error reading configuration file"));
		}
	}

	private JSONObject getTypeChecker() {
		return config.getJSONObject(TypeCheckerOptions.TYPECHECKER_FIELD);
	}
}
