package dev.tessera.testrunner;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;

/**
 * Class loader for an execution context.
 * <p>
 * Names are resolved by walking {@link #RESOLUTION_ORDER}: bridge types always come from the host loader so that
 * both sides of the framework contract see the same {@code Class} objects, then the platform, then this context's
 * own classpath, and finally the context it is layered on (if any). The application class path is never visible.
 * Resources are looked up in the same order.
 */
final class IsolatingClassLoader extends URLClassLoader {
	static {
		ClassLoader.registerAsParallelCapable();
	}

	IsolatingClassLoader(String name, List<URL> urls, ClassLoader host, List<String> bridgePrefixes, @Nullable ClassLoader base) {
		super(name, urls.toArray(URL[]::new), base != null ? base : ClassLoader.getPlatformClassLoader());
		this.host = host;
		this.bridgePrefixes = ImmutableList.copyOf(bridgePrefixes);
		this.base = base;
	}

	enum Source {
		BRIDGE,
		PLATFORM,
		LOCAL,
		BASE,
	}

	static final List<Source> RESOLUTION_ORDER = List.of(Source.BRIDGE, Source.PLATFORM, Source.LOCAL, Source.BASE);

	private final ClassLoader host;
	private final ImmutableList<String> bridgePrefixes;
	private final @Nullable ClassLoader base;

	@Override
	protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
		synchronized(getClassLoadingLock(name)) {
			Class<?> c = findLoadedClass(name);
			if(c == null) {
				for(var source : RESOLUTION_ORDER) {
					c = loadFrom(source, name);
					if(c != null) {
						break;
					}
				}
			}

			if(c == null) {
				throw new ClassNotFoundException(name);
			}

			if(resolve) {
				resolveClass(c);
			}
			return c;
		}
	}

	private @Nullable Class<?> loadFrom(Source source, String name) throws ClassNotFoundException {
		return switch(source) {
			case BRIDGE -> isBridge(name) ? host.loadClass(name) : null;
			case PLATFORM -> tryLoad(ClassLoader.getPlatformClassLoader(), name);
			case LOCAL -> {
				try {
					yield findClass(name);
				}
				catch(ClassNotFoundException e) {
					yield null;
				}
			}
			case BASE -> base == null ? null : tryLoad(base, name);
		};
	}

	/**
	 * Resources follow the same order as classes, minus the bridge step: platform, local entries, then the base.
	 */
	@Override
	public @Nullable URL getResource(String name) {
		var url = ClassLoader.getPlatformClassLoader().getResource(name);
		if(url == null) {
			url = findResource(name);
		}
		if(url == null && base != null) {
			url = base.getResource(name);
		}
		return url;
	}

	@Override
	public Enumeration<URL> getResources(String name) throws IOException {
		var urls = new ArrayList<URL>();
		urls.addAll(Collections.list(ClassLoader.getPlatformClassLoader().getResources(name)));
		urls.addAll(Collections.list(findResources(name)));
		if(base != null) {
			urls.addAll(Collections.list(base.getResources(name)));
		}
		return Collections.enumeration(urls);
	}

	boolean isBridge(String name) {
		for(var prefix : bridgePrefixes) {
			if(name.startsWith(prefix)) {
				return true;
			}
		}
		return false;
	}

	private static @Nullable Class<?> tryLoad(ClassLoader loader, String name) {
		try {
			return loader.loadClass(name);
		}
		catch(ClassNotFoundException e) {
			return null;
		}
	}
}
