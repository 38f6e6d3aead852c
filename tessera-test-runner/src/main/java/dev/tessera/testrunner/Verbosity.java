package dev.tessera.testrunner;

public enum Verbosity {
	LOW,
	MEDIUM,
	HIGH,
	;

	public boolean includes(Verbosity level) {
		return compareTo(level) >= 0;
	}
}
