package dev.tessera.testrunner;

import org.apache.commons.io.file.PathUtils;

import java.io.IOException;
import java.nio.file.Path;

final class StatusFile {
	private StatusFile() {}

	/**
	 * Creates the file, or refreshes its modification time if it already exists.
	 */
	public static void touch(Path path) throws IOException {
		PathUtils.touch(path);
	}
}
