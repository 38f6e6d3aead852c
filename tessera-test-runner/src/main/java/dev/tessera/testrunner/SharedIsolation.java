package dev.tessera.testrunner;

import java.io.IOException;
import java.util.List;

/**
 * Every framework and test runs in one context built over the full classpath.
 */
final class SharedIsolation implements IsolationStrategy {
	SharedIsolation(TestClasspath classpath) {
		this.context = ExecutionContext.create("tessera-shared", classpath.entries(), null);
	}

	private final ExecutionContext context;

	@Override
	public ExecutionContext discoveryContext() {
		return context;
	}

	@Override
	public TestFrameworkRunner runnerFor(FrameworkHandle framework, TestLogger logger, List<String> frameworkArgs) {
		return new BasicTestRunner(framework, context, logger, frameworkArgs);
	}

	@Override
	public void close() throws IOException {
		context.close();
	}
}
