package dev.tessera.testrunner;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sbt.testing.Framework;

import java.lang.reflect.InvocationTargetException;
import java.util.List;

/**
 * Instantiates {@link Framework} implementations by class name inside an execution context.
 * A framework that cannot be loaded is reported and skipped.
 */
public final class FrameworkLoader {
	public FrameworkLoader(ExecutionContext context, TestLogger logger) {
		this.context = context;
		this.logger = logger;
	}

	private static final Logger log = LoggerFactory.getLogger(FrameworkLoader.class);

	private final ExecutionContext context;
	private final TestLogger logger;

	public ImmutableList<FrameworkHandle> loadAll(List<String> classNames) {
		var frameworks = ImmutableList.<FrameworkHandle>builder();
		for(var className : classNames) {
			var result = load(className);
			if(result instanceof FrameworkLoadResult.Loaded loaded) {
				frameworks.add(loaded.handle());
			}
			else if(result instanceof FrameworkLoadResult.Failed failed) {
				logger.warn(failed.message());
				if(failed.cause() != null) {
					log.debug("Framework {} could not be loaded", className, failed.cause());
				}
			}
		}
		return frameworks.build();
	}

	public FrameworkLoadResult load(String className) {
		Class<?> frameworkClass;
		try {
			frameworkClass = context.loadClass(className);
		}
		catch(ClassNotFoundException e) {
			return new FrameworkLoadResult.Failed(className, "class not found in " + context.name(), null);
		}
		catch(LinkageError e) {
			return new FrameworkLoadResult.Failed(className, "class could not be linked", e);
		}

		if(!Framework.class.isAssignableFrom(frameworkClass)) {
			return new FrameworkLoadResult.Failed(className, "does not implement " + Framework.class.getName(), null);
		}

		try {
			var framework = (Framework)frameworkClass.getDeclaredConstructor().newInstance();
			log.debug("Loaded framework {} ({}) in {}", framework.name(), className, context.name());
			return new FrameworkLoadResult.Loaded(new FrameworkHandle(className, framework));
		}
		catch(InvocationTargetException e) {
			return new FrameworkLoadResult.Failed(className, "constructor failed", e.getCause());
		}
		catch(ReflectiveOperationException | RuntimeException | LinkageError e) {
			return new FrameworkLoadResult.Failed(className, "could not be instantiated", e);
		}
	}
}
