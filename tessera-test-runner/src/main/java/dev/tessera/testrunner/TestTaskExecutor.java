package dev.tessera.testrunner;

import sbt.testing.Event;
import sbt.testing.EventHandler;
import sbt.testing.Logger;
import sbt.testing.Task;

import java.util.Set;

/**
 * Executes a task and every task it spawns, streaming events to the reporter and collecting failures.
 */
final class TestTaskExecutor {
	TestTaskExecutor(TestReporter reporter, TestLogger logger) {
		this.reporter = reporter;
		this.loggers = new Logger[] { logger };
	}

	private final TestReporter reporter;
	private final Logger[] loggers;

	public void execute(Task task, Set<String> failures) {
		EventHandler handler = (Event event) -> {
			reporter.event(event);
			if(TestReporter.isFailure(event.status())) {
				failures.add(TestReporter.testName(event));
			}
		};

		executeTree(task, handler);
	}

	private void executeTree(Task task, EventHandler handler) {
		var nested = task.execute(handler, loggers);
		if(nested == null) {
			return;
		}

		for(var child : nested) {
			executeTree(child, handler);
		}
	}
}
