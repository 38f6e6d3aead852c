package dev.tessera.testrunner;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Path;
import java.util.Collection;

/**
 * The test classpath and the subset of it that isolated contexts share.
 */
public record TestClasspath(ImmutableList<Path> entries, ImmutableSet<Path> sharedEntries) {

	public static TestClasspath of(Collection<Path> entries, Collection<Path> shared) {
		return new TestClasspath(
			entries.stream().map(TestClasspath::normalize).collect(ImmutableList.toImmutableList()),
			shared.stream().map(TestClasspath::normalize).collect(ImmutableSet.toImmutableSet())
		);
	}

	public ImmutableList<Path> shared() {
		return entries.stream().filter(sharedEntries::contains).collect(ImmutableList.toImmutableList());
	}

	public ImmutableList<Path> isolated() {
		return entries.stream().filter(entry -> !sharedEntries.contains(entry)).collect(ImmutableList.toImmutableList());
	}

	public static ImmutableList<URL> toUrls(Collection<Path> paths) {
		var urls = ImmutableList.<URL>builder();
		for(var path : paths) {
			try {
				urls.add(path.toUri().toURL());
			}
			catch(MalformedURLException e) {
				throw new IllegalArgumentException("Invalid classpath entry: " + path, e);
			}
		}
		return urls.build();
	}

	private static Path normalize(Path path) {
		return path.toAbsolutePath().normalize();
	}
}
