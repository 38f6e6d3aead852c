package dev.tessera.testrunner;

import sbt.testing.AnnotatedFingerprint;
import sbt.testing.Fingerprint;
import sbt.testing.Selector;
import sbt.testing.SubclassFingerprint;
import sbt.testing.SuiteSelector;
import sbt.testing.TaskDef;
import sbt.testing.TestWildcardSelector;

/**
 * A discovered test fixture and the fingerprint that recognized it.
 */
public record TestDefinition(String name, Fingerprint fingerprint) {

	/**
	 * Whether the fixture is a singleton module rather than a class the framework instantiates.
	 */
	public boolean isModule() {
		if(fingerprint instanceof SubclassFingerprint subclass) {
			return subclass.isModule();
		}
		else if(fingerprint instanceof AnnotatedFingerprint annotated) {
			return annotated.isModule();
		}
		return false;
	}

	public TaskDef toTaskDef(String scopeAndName) {
		Selector selector = scopeAndName.isEmpty()
			? new SuiteSelector()
			: new TestWildcardSelector(scopeAndName);
		return new TaskDef(name, fingerprint, false, new Selector[] { selector });
	}
}
