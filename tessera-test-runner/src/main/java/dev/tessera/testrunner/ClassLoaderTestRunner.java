package dev.tessera.testrunner;

import java.io.IOException;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs a framework's batch in a freshly constructed execution context.
 * The framework is reloaded inside that context so none of its state survives the batch.
 */
class ClassLoaderTestRunner implements TestFrameworkRunner {
	ClassLoaderTestRunner(FrameworkHandle framework, Supplier<ExecutionContext> contextProvider, TestLogger logger, List<String> frameworkArgs) {
		this.framework = framework;
		this.contextProvider = contextProvider;
		this.logger = logger;
		this.frameworkArgs = frameworkArgs;
	}

	private final FrameworkHandle framework;
	private final Supplier<ExecutionContext> contextProvider;
	private final TestLogger logger;
	private final List<String> frameworkArgs;

	@Override
	public boolean execute(List<TestDefinition> tests, String scopeAndName) {
		var context = contextProvider.get();
		try {
			var result = new FrameworkLoader(context, logger).load(framework.className());
			if(result instanceof FrameworkLoadResult.Failed failed) {
				logger.error(failed.message());
				return false;
			}

			var isolated = ((FrameworkLoadResult.Loaded)result).handle();
			return new BasicTestRunner(isolated, context, logger, frameworkArgs).execute(tests, scopeAndName);
		}
		finally {
			try {
				context.close();
			}
			catch(IOException e) {
				logger.warn("Failed to release " + context.name() + ": " + e);
			}
		}
	}
}
