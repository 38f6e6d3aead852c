package dev.tessera.testrunner;

import com.google.common.collect.ImmutableList;
import dev.tessera.testrunner.index.SymbolIndex;

/**
 * Finds the fixtures a framework can run by matching its fingerprints against the symbol index.
 * Output follows index order.
 */
public final class TestDiscovery {
	public TestDiscovery(FrameworkHandle framework) {
		this.framework = framework;
	}

	private final FrameworkHandle framework;

	public ImmutableList<TestDefinition> discover(SymbolIndex index) {
		var tests = ImmutableList.<TestDefinition>builder();
		for(var symbol : index.shapes()) {
			for(var fingerprint : framework.matchingFingerprints(symbol)) {
				tests.add(new TestDefinition(symbol.name(), fingerprint));
			}
		}
		return tests.build();
	}
}
