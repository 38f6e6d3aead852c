package dev.tessera.testrunner;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Selectors handed to the runner by the invoking harness through environment variables.
 * Read once at startup.
 */
public record TestEnvironment(
	@Nullable TestOnlySelector testOnly,
	@Nullable ShardSpec shard,
	@Nullable Path statusFile
) {
	public static final String TEST_ONLY = "TESTBRIDGE_TEST_ONLY";
	public static final String SHARD_INDEX = "TEST_SHARD_INDEX";
	public static final String TOTAL_SHARDS = "TEST_TOTAL_SHARDS";
	public static final String SHARD_STATUS_FILE = "TEST_SHARD_STATUS_FILE";

	public static TestEnvironment empty() {
		return new TestEnvironment(null, null, null);
	}

	public static TestEnvironment fromMap(Map<String, String> env) {
		var testOnlyText = env.get(TEST_ONLY);
		var testOnly = testOnlyText == null ? null : TestOnlySelector.parse(testOnlyText);

		var indexText = env.get(SHARD_INDEX);
		var totalText = env.get(TOTAL_SHARDS);
		ShardSpec shard = null;
		if(indexText != null && totalText != null) {
			shard = new ShardSpec(parseShardValue(SHARD_INDEX, indexText), parseShardValue(TOTAL_SHARDS, totalText));
		}

		var statusFileText = env.get(SHARD_STATUS_FILE);
		var statusFile = statusFileText == null ? null : Path.of(statusFileText);

		return new TestEnvironment(testOnly, shard, statusFile);
	}

	private static int parseShardValue(String name, String value) {
		try {
			return Integer.parseInt(value.trim());
		}
		catch(NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + name + ": " + value, e);
		}
	}

	public @Nullable Pattern namePattern() {
		return testOnly == null ? null : testOnly.namePattern();
	}

	public String scopeAndName() {
		return testOnly == null ? "" : testOnly.scopeAndName();
	}
}
