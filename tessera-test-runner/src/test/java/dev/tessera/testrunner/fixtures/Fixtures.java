package dev.tessera.testrunner.fixtures;

import java.net.URISyntaxException;
import java.nio.file.Path;

public final class Fixtures {
	private Fixtures() {}

	/**
	 * The directory the fixture classes were compiled to. Isolated contexts load them from here.
	 */
	public static Path classesDir() {
		try {
			return Path.of(Fixtures.class.getProtectionDomain().getCodeSource().getLocation().toURI());
		}
		catch(URISyntaxException e) {
			throw new IllegalStateException(e);
		}
	}
}
