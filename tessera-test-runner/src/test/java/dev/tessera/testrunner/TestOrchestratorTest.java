package dev.tessera.testrunner;

import com.google.common.collect.ImmutableList;
import dev.tessera.testrunner.fixtures.BrokenFramework;
import dev.tessera.testrunner.fixtures.FingerprintlessFramework;
import dev.tessera.testrunner.fixtures.FixtureFramework;
import dev.tessera.testrunner.fixtures.Fixtures;
import dev.tessera.testrunner.fixtures.SecondFixtureFramework;
import dev.tessera.testrunner.index.SymbolIndexException;
import dev.tessera.testrunner.index.SymbolShape;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public class TestOrchestratorTest {

	@TempDir
	Path tempDir;

	private final CapturedOutput output = new CapturedOutput();

	private RunnerConfig config(IsolationMode isolation, Path apis, String... frameworks) {
		return new RunnerConfig(
			apis,
			isolation,
			TestClasspath.of(List.of(Fixtures.classesDir()), List.of()),
			ImmutableList.copyOf(frameworks),
			ImmutableList.of("-v")
		);
	}

	private boolean run(RunnerConfig config, TestEnvironment environment, Verbosity verbosity) throws IOException {
		return new TestOrchestrator(config, environment, output.logger(verbosity)).run();
	}

	private Path index(SymbolShape... shapes) throws IOException {
		return FixtureIndexes.write(tempDir.resolve("apis.gz"), shapes);
	}

	@Test
	public void passingTestsPass() throws IOException {
		var apis = index(FixtureIndexes.suite("PassingSuite"), FixtureIndexes.abstractSuite(), FixtureIndexes.annotated("AnnotatedFixture"));

		Assertions.assertTrue(run(config(IsolationMode.NONE, apis, FixtureFramework.class.getName()), TestEnvironment.empty(), Verbosity.MEDIUM));

		var text = output.text();
		Assertions.assertTrue(text.contains("Fixture: running 2 tests"), text);
		Assertions.assertTrue(text.contains("+ " + FixtureIndexes.FIXTURES + "PassingSuite"), text);
		Assertions.assertTrue(text.contains("+ " + FixtureIndexes.FIXTURES + "AnnotatedFixture"), text);
		Assertions.assertTrue(text.contains("Fixture runner done: 2 tasks, args [-v]"), text);
	}

	@Test
	public void failingTestFailsTheRun() throws IOException {
		var apis = index(FixtureIndexes.suite("PassingSuite"), FixtureIndexes.suite("FailingSuite"));

		Assertions.assertFalse(run(config(IsolationMode.NONE, apis, FixtureFramework.class.getName()), TestEnvironment.empty(), Verbosity.MEDIUM));

		var text = output.text();
		Assertions.assertTrue(text.contains("x " + FixtureIndexes.FIXTURES + "FailingSuite"), text);
		Assertions.assertTrue(text.contains("expected failure"), text);
		Assertions.assertTrue(text.contains("Fixture: 1 failure:"), text);
	}

	@Test
	public void brokenFrameworkDoesNotStopOthers() throws IOException {
		var apis = index(FixtureIndexes.suite("PassingSuite"));
		var config = config(IsolationMode.NONE, apis, BrokenFramework.class.getName(), FixtureFramework.class.getName());

		Assertions.assertTrue(run(config, TestEnvironment.empty(), Verbosity.MEDIUM));

		var text = output.text();
		Assertions.assertTrue(text.contains("Failed to load framework " + BrokenFramework.class.getName()), text);
		Assertions.assertTrue(text.contains("+ " + FixtureIndexes.FIXTURES + "PassingSuite"), text);
	}

	@Test
	public void discoveryErrorFailsOnlyThatFramework() throws IOException {
		var apis = index(FixtureIndexes.suite("PassingSuite"));
		var config = config(IsolationMode.NONE, apis, FingerprintlessFramework.class.getName(), FixtureFramework.class.getName());

		Assertions.assertFalse(run(config, TestEnvironment.empty(), Verbosity.MEDIUM));

		var text = output.text();
		Assertions.assertTrue(text.contains("Error discovering tests for framework " + FingerprintlessFramework.class.getName()), text);
		Assertions.assertTrue(text.contains("fingerprints unavailable"), text);
		Assertions.assertTrue(text.contains("+ " + FixtureIndexes.FIXTURES + "PassingSuite"), text);
		Assertions.assertTrue(text.contains("Fixture: all tests passed"), text);
	}

	@Test
	public void noFrameworksIsVacuousPass() throws IOException {
		var apis = index(FixtureIndexes.suite("FailingSuite"));

		Assertions.assertTrue(run(config(IsolationMode.NONE, apis), TestEnvironment.empty(), Verbosity.MEDIUM));
	}

	@Test
	public void filterMatchingNothingIsVacuousPass() throws IOException {
		var apis = index(FixtureIndexes.suite("FailingSuite"));
		var environment = TestEnvironment.fromMap(Map.of(TestEnvironment.TEST_ONLY, "no\\.such\\.Test"));

		Assertions.assertTrue(run(config(IsolationMode.NONE, apis, FixtureFramework.class.getName()), environment, Verbosity.MEDIUM));
		Assertions.assertFalse(output.text().contains("running"), output.text());
	}

	@Test
	public void sharedContextLeaksStateBetweenFrameworks() throws IOException {
		var apis = index(FixtureIndexes.suite("CountingSuite"));
		var config = config(IsolationMode.NONE, apis, FixtureFramework.class.getName(), SecondFixtureFramework.class.getName());

		Assertions.assertFalse(run(config, TestEnvironment.empty(), Verbosity.MEDIUM));

		var text = output.text();
		Assertions.assertTrue(text.contains("state leaked from an earlier run: 2"), text);
	}

	@Test
	public void classLoaderIsolationGivesEachFrameworkAFreshContext() throws IOException {
		var apis = index(FixtureIndexes.suite("CountingSuite"));
		var config = config(IsolationMode.CLASSLOADER, apis, FixtureFramework.class.getName(), SecondFixtureFramework.class.getName());

		Assertions.assertTrue(run(config, TestEnvironment.empty(), Verbosity.HIGH));

		var text = output.text();
		Assertions.assertTrue(text.contains("loaded by tessera-isolated-1"), text);
		Assertions.assertTrue(text.contains("loaded by tessera-isolated-2"), text);
		Assertions.assertTrue(text.contains("SecondFixture: all tests passed"), text);
	}

	@Test
	public void shardsContinueAcrossFrameworks() throws IOException {
		var apis = index(FixtureIndexes.suite("PassingSuite"), FixtureIndexes.annotated("AnnotatedFixture"));
		var environment = TestEnvironment.fromMap(Map.of(
			TestEnvironment.SHARD_INDEX, "0",
			TestEnvironment.TOTAL_SHARDS, "2"
		));
		var config = config(IsolationMode.NONE, apis, FixtureFramework.class.getName(), SecondFixtureFramework.class.getName());

		Assertions.assertTrue(run(config, environment, Verbosity.MEDIUM));

		// Ordinals: Fixture gets AnnotatedFixture=1, PassingSuite=2; SecondFixture gets AnnotatedFixture=3, PassingSuite=4
		var text = output.text();
		Assertions.assertTrue(text.contains("Fixture: running 1 test\n"), text);
		Assertions.assertTrue(text.contains("SecondFixture: running 1 test\n"), text);
		Assertions.assertFalse(text.contains("+ " + FixtureIndexes.FIXTURES + "AnnotatedFixture"), text);
	}

	@Test
	public void scopeHintReachesFramework() throws IOException {
		var apis = index(FixtureIndexes.suite("PassingSuite"), FixtureIndexes.suite("FailingSuite"));
		var environment = TestEnvironment.fromMap(Map.of(
			TestEnvironment.TEST_ONLY, "dev\\.tessera\\.testrunner\\.fixtures\\.PassingSuite#adds numbers$"
		));

		Assertions.assertTrue(run(config(IsolationMode.CLASSLOADER, apis, FixtureFramework.class.getName()), environment, Verbosity.MEDIUM));
		Assertions.assertTrue(output.text().contains("+ " + FixtureIndexes.FIXTURES + "PassingSuite.adds numbers"), output.text());
	}

	@Test
	public void unreadableIndexIsFatal() {
		var apis = tempDir.resolve("missing.gz");

		var e = Assertions.assertThrows(
			SymbolIndexException.class,
			() -> run(config(IsolationMode.NONE, apis, FixtureFramework.class.getName()), TestEnvironment.empty(), Verbosity.MEDIUM)
		);
		Assertions.assertTrue(e.getMessage().contains(apis.toString()));
	}

	@Test
	public void processIsolationFailsFast() throws IOException {
		var apis = index(FixtureIndexes.suite("PassingSuite"));

		Assertions.assertThrows(
			UnsupportedOperationException.class,
			() -> run(config(IsolationMode.PROCESS, apis, FixtureFramework.class.getName()), TestEnvironment.empty(), Verbosity.MEDIUM)
		);
		Assertions.assertFalse(output.text().contains("running"));
	}
}
