package dev.tessera.testrunner;

import com.google.common.collect.ImmutableList;

import java.nio.file.Path;

public record RunnerConfig(
	Path apisFile,
	IsolationMode isolation,
	TestClasspath classpath,
	ImmutableList<String> frameworks,
	ImmutableList<String> frameworkArgs
) {
}
