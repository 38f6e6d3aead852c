package dev.tessera.testrunner;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum IsolationMode {
	NONE("none"),
	CLASSLOADER("classloader"),
	PROCESS("process"),
	;

	IsolationMode(String id) {
		this.id = id;
	}

	private final String id;

	public String modeId() {
		return id;
	}

	public static IsolationMode fromId(String id) {
		for(var mode : values()) {
			if(mode.id.equals(id)) {
				return mode;
			}
		}

		throw new IllegalArgumentException(
			"Unknown isolation mode: " + id + " (expected one of " +
				Arrays.stream(values()).map(IsolationMode::modeId).collect(Collectors.joining(", ")) + ")"
		);
	}
}
