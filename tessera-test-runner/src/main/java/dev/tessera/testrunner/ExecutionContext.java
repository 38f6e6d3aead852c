package dev.tessera.testrunner;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * An isolation boundary that resolves class names to runnable code.
 */
public final class ExecutionContext implements Closeable {
	private ExecutionContext(String name, ImmutableList<Path> classpath, IsolatingClassLoader classLoader) {
		this.name = name;
		this.classpath = classpath;
		this.classLoader = classLoader;
	}

	private static final Logger log = LoggerFactory.getLogger(ExecutionContext.class);

	/**
	 * Types the orchestrator and the frameworks talk through. Always resolved from the orchestrator's loader.
	 */
	public static final List<String> BRIDGE_PREFIXES = List.of("sbt.testing.");

	private final String name;
	private final ImmutableList<Path> classpath;
	private final IsolatingClassLoader classLoader;

	public static ExecutionContext create(String name, List<Path> classpath, @Nullable ExecutionContext base) {
		log.debug("Creating execution context {} with {} classpath entries", name, classpath.size());
		var loader = new IsolatingClassLoader(
			name,
			TestClasspath.toUrls(classpath),
			ExecutionContext.class.getClassLoader(),
			BRIDGE_PREFIXES,
			base == null ? null : base.classLoader
		);
		return new ExecutionContext(name, ImmutableList.copyOf(classpath), loader);
	}

	public String name() {
		return name;
	}

	public ImmutableList<Path> classpath() {
		return classpath;
	}

	public ClassLoader classLoader() {
		return classLoader;
	}

	public Class<?> loadClass(String className) throws ClassNotFoundException {
		return Class.forName(className, true, classLoader);
	}

	/**
	 * Runs the action with this context installed as the thread context class loader.
	 */
	public <T> T call(Callable<T> action) throws Exception {
		var thread = Thread.currentThread();
		var previous = thread.getContextClassLoader();
		thread.setContextClassLoader(classLoader);
		try {
			return action.call();
		}
		finally {
			thread.setContextClassLoader(previous);
		}
	}

	@Override
	public void close() throws IOException {
		log.debug("Closing execution context {}", name);
		classLoader.close();
	}

	@Override
	public String toString() {
		return "ExecutionContext{" + name + '}';
	}
}
