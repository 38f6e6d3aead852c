package dev.tessera.testrunner;

import sbt.testing.Logger;

import java.io.PrintStream;

/**
 * Human-readable progress sink shared with the test frameworks.
 * Errors and warnings are always shown, info from {@link Verbosity#MEDIUM}, debug only at {@link Verbosity#HIGH}.
 */
public final class TestLogger implements Logger {
	public TestLogger(PrintStream out, boolean color, Verbosity verbosity) {
		this.out = out;
		this.color = color;
		this.verbosity = verbosity;
	}

	private static final String RED = "\u001b[31m";
	private static final String GREEN = "\u001b[32m";
	private static final String YELLOW = "\u001b[33m";
	private static final String RESET = "\u001b[0m";

	private final PrintStream out;
	private final boolean color;
	private final Verbosity verbosity;

	@Override
	public boolean ansiCodesSupported() {
		return color;
	}

	@Override
	public void error(String msg) {
		out.println(msg);
	}

	@Override
	public void warn(String msg) {
		out.println(msg);
	}

	@Override
	public void info(String msg) {
		if(verbosity.includes(Verbosity.MEDIUM)) {
			out.println(msg);
		}
	}

	@Override
	public void debug(String msg) {
		if(verbosity.includes(Verbosity.HIGH)) {
			out.println(msg);
		}
	}

	@Override
	public void trace(Throwable t) {
		if(verbosity.includes(Verbosity.HIGH)) {
			t.printStackTrace(out);
		}
		else {
			out.println(t);
		}
	}

	public String red(String text) {
		return colored(RED, text);
	}

	public String green(String text) {
		return colored(GREEN, text);
	}

	public String yellow(String text) {
		return colored(YELLOW, text);
	}

	private String colored(String code, String text) {
		return color ? code + text + RESET : text;
	}
}
