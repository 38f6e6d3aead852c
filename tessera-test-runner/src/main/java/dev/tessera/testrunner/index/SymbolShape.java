package dev.tessera.testrunner.index;

import com.google.common.collect.ImmutableSet;

/**
 * The structural shape of a top-level symbol, as far as fingerprint matching needs it.
 */
public record SymbolShape(
	String name,
	SymbolKind kind,
	boolean isAbstract,
	ImmutableSet<String> baseClasses,
	ImmutableSet<String> annotations,
	ImmutableSet<String> methodAnnotations,
	boolean hasNoArgConstructor
) {

	public boolean isModule() {
		return kind == SymbolKind.MODULE;
	}

	public boolean isConcrete() {
		return kind != SymbolKind.TRAIT && !isAbstract;
	}

	public static SymbolShape concreteClass(String name, String... baseClasses) {
		return new SymbolShape(name, SymbolKind.CLASS, false, ImmutableSet.copyOf(baseClasses), ImmutableSet.of(), ImmutableSet.of(), true);
	}

	static SymbolShape fromEntry(ApiEntry entry) {
		if(entry.getName() == null || entry.getName().isEmpty()) {
			throw new IllegalArgumentException("Symbol without a name: " + entry);
		}

		return new SymbolShape(
			entry.getName(),
			entry.getKind() == null ? SymbolKind.CLASS : entry.getKind(),
			entry.isAbstractSymbol(),
			ImmutableSet.copyOf(entry.getBaseClasses()),
			ImmutableSet.copyOf(entry.getAnnotations()),
			ImmutableSet.copyOf(entry.getMethodAnnotations()),
			entry.isNoArgConstructor()
		);
	}

	ApiEntry toEntry() {
		var entry = new ApiEntry();
		entry.setName(name);
		entry.setKind(kind);
		entry.setAbstractSymbol(isAbstract);
		entry.setNoArgConstructor(hasNoArgConstructor);
		entry.setBaseClasses(baseClasses.asList());
		entry.setAnnotations(annotations.asList());
		entry.setMethodAnnotations(methodAnnotations.asList());
		return entry;
	}
}
