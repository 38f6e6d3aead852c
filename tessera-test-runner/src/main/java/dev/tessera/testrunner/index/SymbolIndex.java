package dev.tessera.testrunner.index;

import com.google.common.collect.ImmutableCollection;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;

/**
 * Top-level symbols declared by the compiled test classpath, in index order.
 */
public final class SymbolIndex {
	private SymbolIndex(ImmutableMap<String, SymbolShape> symbols) {
		this.symbols = symbols;
	}

	private final ImmutableMap<String, SymbolShape> symbols;

	public static SymbolIndex of(Collection<SymbolShape> shapes) {
		var builder = ImmutableMap.<String, SymbolShape>builder();
		for(var shape : shapes) {
			builder.put(shape.name(), shape);
		}
		return new SymbolIndex(builder.buildOrThrow());
	}

	public ImmutableSet<String> names() {
		return symbols.keySet();
	}

	public ImmutableCollection<SymbolShape> shapes() {
		return symbols.values();
	}

	public @Nullable SymbolShape shape(String name) {
		return symbols.get(name);
	}

	public int size() {
		return symbols.size();
	}
}
