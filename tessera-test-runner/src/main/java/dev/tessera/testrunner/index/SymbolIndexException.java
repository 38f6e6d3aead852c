package dev.tessera.testrunner.index;

import java.io.IOException;
import java.nio.file.Path;

public class SymbolIndexException extends IOException {
	public SymbolIndexException(Path path, Throwable cause) {
		super("Failed to load APIs from " + path, cause);
		this.path = path;
	}

	private final Path path;

	public Path getPath() {
		return path;
	}
}
