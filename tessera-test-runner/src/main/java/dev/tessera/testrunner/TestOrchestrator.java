package dev.tessera.testrunner;

import dev.tessera.testrunner.index.SymbolIndex;
import dev.tessera.testrunner.index.SymbolIndexFile;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Reads the symbol index, loads the frameworks, and runs each framework's selected tests in turn.
 */
public final class TestOrchestrator {
	public TestOrchestrator(RunnerConfig config, TestEnvironment environment, TestLogger logger) {
		this.config = config;
		this.environment = environment;
		this.logger = logger;
	}

	private static final Logger log = LoggerFactory.getLogger(TestOrchestrator.class);

	private final RunnerConfig config;
	private final TestEnvironment environment;
	private final TestLogger logger;

	/**
	 * @return whether every framework's tests passed; vacuously true when nothing was selected
	 * @throws IOException if the symbol index cannot be read
	 */
	public boolean run() throws IOException {
		var index = SymbolIndexFile.read(config.apisFile());
		log.debug("Read {} symbols from {}", index.size(), config.apisFile());

		try(var isolation = IsolationStrategy.create(config.isolation(), config.classpath())) {
			var frameworks = new FrameworkLoader(isolation.discoveryContext(), logger).loadAll(config.frameworks());
			var selection = TestSelection.forEnvironment(environment);

			boolean passed = true;
			for(var framework : frameworks) {
				var tests = discover(framework, index);
				if(tests == null) {
					passed = false;
					continue;
				}

				var selected = selection.select(tests);
				logger.debug(framework.className() + ": discovered " + tests.size() + ", selected " + selected.size());
				if(selected.isEmpty()) {
					continue;
				}

				var runner = isolation.runnerFor(framework, logger, config.frameworkArgs());
				if(!runner.execute(selected, environment.scopeAndName())) {
					passed = false;
				}
			}
			return passed;
		}
	}

	private @Nullable List<TestDefinition> discover(FrameworkHandle framework, SymbolIndex index) {
		try {
			return new TestDiscovery(framework).discover(index);
		}
		catch(RuntimeException | LinkageError e) {
			logger.error("Error discovering tests for framework " + framework.className() + ": " + e);
			logger.trace(e);
			return null;
		}
	}
}
