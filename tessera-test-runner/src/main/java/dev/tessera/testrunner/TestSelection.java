package dev.tessera.testrunner;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Comparator;
import java.util.regex.Pattern;

/**
 * Name filtering and shard partitioning over sorted test lists.
 * <p>
 * One instance spans a whole run: the ordinal counter keeps counting across every call to {@link #select}, so the
 * shards partition the concatenation of all frameworks' sorted tests rather than each framework separately.
 * A test that passes the name filter takes the next ordinal (starting at 1) whether or not its shard keeps it.
 */
public final class TestSelection {
	public TestSelection(@Nullable Pattern namePattern, @Nullable ShardSpec shard) {
		this.namePattern = namePattern;
		this.shard = shard;
	}

	private final @Nullable Pattern namePattern;
	private final @Nullable ShardSpec shard;
	private int count = 0;

	public static TestSelection forEnvironment(TestEnvironment environment) {
		return new TestSelection(environment.namePattern(), environment.shard());
	}

	public synchronized ImmutableList<TestDefinition> select(Collection<TestDefinition> tests) {
		var sorted = tests.stream()
			.sorted(Comparator.comparing(TestDefinition::name))
			.toList();

		var selected = ImmutableList.<TestDefinition>builder();
		for(var test : sorted) {
			if(namePattern != null && !namePattern.matcher(test.name()).matches()) {
				continue;
			}

			++count;
			if(shard == null || shard.includes(count)) {
				selected.add(test);
			}
		}
		return selected.build();
	}

	public synchronized int count() {
		return count;
	}
}
