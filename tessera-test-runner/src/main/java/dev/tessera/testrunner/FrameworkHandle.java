package dev.tessera.testrunner;

import com.google.common.collect.ImmutableList;
import dev.tessera.testrunner.index.SymbolShape;
import sbt.testing.AnnotatedFingerprint;
import sbt.testing.Fingerprint;
import sbt.testing.Framework;
import sbt.testing.Runner;
import sbt.testing.SubclassFingerprint;

import java.util.List;

/**
 * A loaded test framework, identified by the name of its implementation class.
 */
public record FrameworkHandle(String className, Framework framework) {

	public String name() {
		return framework.name();
	}

	public ImmutableList<Fingerprint> fingerprints() {
		return ImmutableList.copyOf(framework.fingerprints());
	}

	/**
	 * Returns the fingerprints of this framework that recognize the symbol as a runnable test.
	 */
	public ImmutableList<Fingerprint> matchingFingerprints(SymbolShape symbol) {
		return fingerprints().stream()
			.filter(fingerprint -> matches(fingerprint, symbol))
			.collect(ImmutableList.toImmutableList());
	}

	public Runner newRunner(ExecutionContext context, List<String> args) {
		return framework.runner(args.toArray(String[]::new), new String[0], context.classLoader());
	}

	static boolean matches(Fingerprint fingerprint, SymbolShape symbol) {
		if(!symbol.isConcrete()) {
			return false;
		}

		if(fingerprint instanceof SubclassFingerprint subclass) {
			return subclass.isModule() == symbol.isModule() &&
				symbol.baseClasses().contains(subclass.superclassName()) &&
				(symbol.isModule() || !subclass.requireNoArgConstructor() || symbol.hasNoArgConstructor());
		}
		else if(fingerprint instanceof AnnotatedFingerprint annotated) {
			return annotated.isModule() == symbol.isModule() &&
				(symbol.annotations().contains(annotated.annotationName()) ||
					symbol.methodAnnotations().contains(annotated.annotationName()));
		}
		else {
			return false;
		}
	}
}
