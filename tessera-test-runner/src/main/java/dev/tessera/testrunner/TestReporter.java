package dev.tessera.testrunner;

import sbt.testing.Event;
import sbt.testing.NestedSuiteSelector;
import sbt.testing.NestedTestSelector;
import sbt.testing.Selector;
import sbt.testing.Status;
import sbt.testing.TaskDef;
import sbt.testing.TestSelector;
import sbt.testing.TestWildcardSelector;

import java.util.Collection;
import java.util.Locale;

/**
 * Writes test progress to the {@link TestLogger} as events arrive.
 */
final class TestReporter {
	TestReporter(TestLogger logger) {
		this.logger = logger;
	}

	private final TestLogger logger;

	public void pre(FrameworkHandle framework, int testCount) {
		logger.info(framework.name() + ": running " + testCount + (testCount == 1 ? " test" : " tests"));
	}

	public void preTask(TaskDef taskDef) {
		logger.info(taskDef.fullyQualifiedName());
	}

	public void event(Event event) {
		var name = testName(event);
		var duration = event.duration() >= 0 ? " (" + event.duration() + " ms)" : "";

		switch(event.status()) {
			case Success -> logger.info("  " + logger.green("+ " + name) + duration);
			case Failure -> logger.error("  " + logger.red("x " + name) + duration);
			case Error -> logger.error("  " + logger.red("! " + name) + duration);
			default -> logger.info("  " + logger.yellow("- " + name) + " (" + event.status().name().toLowerCase(Locale.ROOT) + ")");
		}

		if(isFailure(event.status()) && event.throwable().isDefined()) {
			logger.trace(event.throwable().get());
		}
	}

	public void post(FrameworkHandle framework, Collection<String> failures) {
		if(failures.isEmpty()) {
			logger.info(framework.name() + ": all tests passed");
			return;
		}

		logger.error(framework.name() + ": " + failures.size() + (failures.size() == 1 ? " failure:" : " failures:"));
		for(var failure : failures) {
			logger.error("    " + logger.red(failure));
		}
		logger.error("");
	}

	public void summary(String summary) {
		if(summary != null && !summary.isEmpty()) {
			logger.info(summary);
		}
	}

	static boolean isFailure(Status status) {
		return status == Status.Failure || status == Status.Error;
	}

	static String testName(Event event) {
		return event.fullyQualifiedName() + selectorSuffix(event.selector());
	}

	private static String selectorSuffix(Selector selector) {
		if(selector instanceof TestSelector test) {
			return "." + test.testName();
		}
		else if(selector instanceof NestedTestSelector nested) {
			return "." + nested.suiteId() + "." + nested.testName();
		}
		else if(selector instanceof NestedSuiteSelector nested) {
			return "." + nested.suiteId();
		}
		else if(selector instanceof TestWildcardSelector wildcard) {
			return "." + wildcard.testWildcard();
		}
		else {
			return "";
		}
	}
}
