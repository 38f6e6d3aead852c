package dev.tessera.testrunner;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.google.common.collect.ImmutableList;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

class TestRunnerArgs {

	@Parameter(names = { "-h", "--help" }, help = true)
	public boolean help = false;

	@Parameter(names = { "--color" }, arity = 1, description = "ANSI color")
	public boolean color = true;

	@Parameter(names = { "--verbosity" }, description = "HIGH, MEDIUM or LOW")
	public Verbosity verbosity = Verbosity.MEDIUM;

	@Parameter(names = { "--apis" }, required = true, description = "Symbol index file")
	public Path apisFile;

	@Parameter(names = { "--isolation" }, converter = IsolationModeConverter.class, description = "Test isolation: none, classloader or process")
	public IsolationMode isolation = IsolationMode.NONE;

	@Parameter(names = { "--frameworks" }, description = "Class names of sbt.testing.Framework implementations")
	public List<String> frameworks = new ArrayList<>();

	@Parameter(names = { "--framework-args" }, description = "Arguments passed to each framework runner")
	public List<String> frameworkArgs = new ArrayList<>();

	@Parameter(names = { "--shared-classpath" }, description = "Classpath entries to share between isolated tests")
	public List<Path> sharedClasspath = new ArrayList<>();

	@Parameter(names = { "--run-path" }, description = "Directory relative paths are resolved against")
	public Path runPath = Path.of(".");

	@Parameter(description = "Testing classpath")
	public List<Path> classpath = new ArrayList<>();

	public RunnerConfig toConfig() {
		var entries = new ArrayList<Path>(classpath.size());
		for(var entry : classpath) {
			var resolved = runPath.resolve(entry);
			if(!Files.isReadable(resolved)) {
				throw new ParameterException("Classpath entry does not exist or is not readable: " + resolved);
			}
			entries.add(resolved);
		}

		var apis = runPath.resolve(apisFile);
		if(!Files.isRegularFile(apis)) {
			throw new ParameterException("Symbol index does not exist: " + apis);
		}

		var shared = sharedClasspath.stream().map(runPath::resolve).toList();

		return new RunnerConfig(
			apis,
			isolation,
			TestClasspath.of(entries, shared),
			ImmutableList.copyOf(frameworks),
			ImmutableList.copyOf(frameworkArgs)
		);
	}

	public static final class IsolationModeConverter implements IStringConverter<IsolationMode> {
		@Override
		public IsolationMode convert(String value) {
			try {
				return IsolationMode.fromId(value);
			}
			catch(IllegalArgumentException e) {
				throw new ParameterException(e.getMessage());
			}
		}
	}
}
