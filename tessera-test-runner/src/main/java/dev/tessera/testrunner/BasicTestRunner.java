package dev.tessera.testrunner;

import sbt.testing.TaskDef;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Runs a framework's tests inside an existing execution context.
 */
class BasicTestRunner implements TestFrameworkRunner {
	BasicTestRunner(FrameworkHandle framework, ExecutionContext context, TestLogger logger, List<String> frameworkArgs) {
		this.framework = framework;
		this.context = context;
		this.logger = logger;
		this.frameworkArgs = frameworkArgs;
	}

	private final FrameworkHandle framework;
	private final ExecutionContext context;
	private final TestLogger logger;
	private final List<String> frameworkArgs;

	@Override
	public boolean execute(List<TestDefinition> tests, String scopeAndName) {
		var reporter = new TestReporter(logger);
		Set<String> failures = new TreeSet<>();

		try {
			return context.call(() -> {
				var runner = framework.newRunner(context, frameworkArgs);
				try {
					var taskDefs = tests.stream().map(test -> test.toTaskDef(scopeAndName)).toArray(TaskDef[]::new);
					var tasks = runner.tasks(taskDefs);
					reporter.pre(framework, tasks.length);

					var executor = new TestTaskExecutor(reporter, logger);
					for(var task : tasks) {
						reporter.preTask(task.taskDef());
						executor.execute(task, failures);
					}
				}
				finally {
					reporter.summary(runner.done());
				}

				reporter.post(framework, failures);
				return failures.isEmpty();
			});
		}
		catch(Throwable t) {
			logger.error("Error running " + framework.name() + " tests in " + context.name() + ": " + t);
			logger.trace(t);
			return false;
		}
	}
}
