package tacheck;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

/**
 * Switches that change which advisories the type checker emits. They never change
 * whether a model is accepted.
 *
 * The JSON form looks like:
 * <pre>
 * { "typechecker": { "refinement_warnings": true, "strict_invariant_warnings": false } }
 * </pre>
 */
public class TypeCheckerOptions {
	public static final String TYPECHECKER_FIELD = "typechecker";
	public static final String REFINEMENT_WARNINGS_FIELD = "refinement_warnings";
	public static final String STRICT_INVARIANT_WARNINGS_FIELD = "strict_invariant_warnings";
	public static final String TARGET_INVARIANT_WARNINGS_FIELD = "target_invariant_warnings";

	private static final Logger logger = Logger.getLogger("TypeCheckerOptions");

	// warn about synchronisation directions that do not suit refinement checking
	public boolean refinementWarnings = false;

	// warn about strict invariants, which controller synthesis cannot handle
	public boolean strictInvariantWarnings = false;

	// warn about broadcast receivers whose guard ignores the target invariant
	public boolean targetInvariantWarnings = false;

	public TypeCheckerOptions() {
	}

	public TypeCheckerOptions(JSONObject config) {
		if (!config.has(TYPECHECKER_FIELD)) {
			return;
		}
		JSONObject typechecker;
		try {
			typechecker = config.getJSONObject(TYPECHECKER_FIELD);
			refinementWarnings = typechecker.optBoolean(REFINEMENT_WARNINGS_FIELD, false);
			strictInvariantWarnings = typechecker.optBoolean(STRICT_INVARIANT_WARNINGS_FIELD, false);
			targetInvariantWarnings = typechecker.optBoolean(TARGET_INVARIANT_WARNINGS_FIELD, false);
		} catch (JSONException e) {
			throw new TypeCheckerOptionException("invalid \"" + TYPECHECKER_FIELD + "\" section: " + e.getMessage());
		}
	}

	public static TypeCheckerOptions parse(String json) {
		JSONObject config;
		try {
			config = new JSONObject(json);
		} catch (JSONException e) {
			throw new TypeCheckerOptionException("parsing error: " + e.getMessage());
		}
		return new TypeCheckerOptions(config);
	}

	public static TypeCheckerOptions load(InputStream in) {
		try {
			return parse(IOUtils.toString(in, StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new TypeCheckerOptionException("error reading configuration: " + e.getMessage());
		}
	}

	public static TypeCheckerOptions load(File configFile) {
		logger.fine("Loading type checker configuration from \"" + configFile + "\"");
		String s;
		try {
			s = FileUtils.readFileToString(configFile, StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new TypeCheckerOptionException("Error reading configuration file: " + e.getMessage());
		}
		try {
			return parse(s);
		} catch (TypeCheckerOptionException e) {
			throw new TypeCheckerOptionException(configFile + ": " + e.getMsg());
		}
	}

	public TypeCheckerOptions withRefinementWarnings(boolean refinementWarnings) {
		this.refinementWarnings = refinementWarnings;
		return this;
	}

	public TypeCheckerOptions withStrictInvariantWarnings(boolean strictInvariantWarnings) {
		this.strictInvariantWarnings = strictInvariantWarnings;
		return this;
	}

	public TypeCheckerOptions withTargetInvariantWarnings(boolean targetInvariantWarnings) {
		this.targetInvariantWarnings = targetInvariantWarnings;
		return this;
	}
}
