package dev.tessera.testrunner;

/**
 * One of {@code total} disjoint partitions of the sorted test stream.
 */
public record ShardSpec(int index, int total) {
	public ShardSpec {
		if(total <= 0) {
			throw new IllegalArgumentException("Total shards must be positive: " + total);
		}

		if(index < 0 || index >= total) {
			throw new IllegalArgumentException("Shard index " + index + " is out of range for " + total + " shards");
		}
	}

	public boolean includes(int ordinal) {
		return ordinal % total == index;
	}
}
