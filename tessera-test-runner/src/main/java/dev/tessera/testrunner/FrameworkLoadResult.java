package dev.tessera.testrunner;

import org.jetbrains.annotations.Nullable;

public sealed interface FrameworkLoadResult {
	record Loaded(FrameworkHandle handle) implements FrameworkLoadResult {}

	record Failed(String className, String reason, @Nullable Throwable cause) implements FrameworkLoadResult {
		public String message() {
			var message = "Failed to load framework " + className + ": " + reason;
			return cause == null ? message : message + " (" + cause + ")";
		}
	}
}
