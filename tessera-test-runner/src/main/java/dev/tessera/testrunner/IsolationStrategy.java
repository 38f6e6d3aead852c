package dev.tessera.testrunner;

import java.io.Closeable;
import java.util.List;

/**
 * Decides how each framework's batch obtains its execution context.
 */
public interface IsolationStrategy extends Closeable {

	/**
	 * The context frameworks are loaded from for discovery. Covers the full classpath and lives for the whole run.
	 */
	ExecutionContext discoveryContext();

	TestFrameworkRunner runnerFor(FrameworkHandle framework, TestLogger logger, List<String> frameworkArgs);

	static IsolationStrategy create(IsolationMode mode, TestClasspath classpath) {
		return switch(mode) {
			case NONE -> new SharedIsolation(classpath);
			case CLASSLOADER -> new ClassLoaderIsolation(classpath);
			case PROCESS -> throw new UnsupportedOperationException("Process isolation is not implemented");
		};
	}
}
