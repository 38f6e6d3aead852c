package dev.tessera.testrunner;

import java.util.List;

/**
 * Drives one framework's execution protocol over an already selected batch of tests.
 */
public interface TestFrameworkRunner {
	/**
	 * @param scopeAndName narrows execution to a nested scope or test inside each fixture; empty runs whole fixtures
	 * @return whether every executed test passed
	 */
	boolean execute(List<TestDefinition> tests, String scopeAndName);
}
