package dev.tessera.testrunner;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Two-tier isolation: a context over the shared classpath entries is built once, and each framework batch runs in
 * a fresh context over the remaining entries layered on top of it.
 */
final class ClassLoaderIsolation implements IsolationStrategy {
	ClassLoaderIsolation(TestClasspath classpath) {
		this.classpath = classpath;
		this.discoveryContext = ExecutionContext.create("tessera-discovery", classpath.entries(), null);
		this.sharedContext = ExecutionContext.create("tessera-shared", classpath.shared(), null);
	}

	private final TestClasspath classpath;
	private final ExecutionContext discoveryContext;
	private final ExecutionContext sharedContext;
	private final AtomicInteger isolatedCount = new AtomicInteger();

	@Override
	public ExecutionContext discoveryContext() {
		return discoveryContext;
	}

	ExecutionContext sharedContext() {
		return sharedContext;
	}

	/**
	 * Builds a new isolated context. The caller owns it and must close it.
	 */
	ExecutionContext newIsolatedContext() {
		return ExecutionContext.create(
			"tessera-isolated-" + isolatedCount.incrementAndGet(),
			classpath.isolated(),
			sharedContext
		);
	}

	@Override
	public TestFrameworkRunner runnerFor(FrameworkHandle framework, TestLogger logger, List<String> frameworkArgs) {
		return new ClassLoaderTestRunner(framework, this::newIsolatedContext, logger, frameworkArgs);
	}

	@Override
	public void close() throws IOException {
		try {
			discoveryContext.close();
		}
		finally {
			sharedContext.close();
		}
	}
}
