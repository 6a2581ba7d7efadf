package dev.jbang.mediafetch.governor;

import dev.jbang.mediafetch.fetch.SizeLookup;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Time-limited cache of remote attachment sizes. Entries older than the TTL are never returned.
 * When the cache grows past its capacity the older half is dropped in one go, oldest insertion
 * first.
 */
public class SizeCache {
	private static final Logger logger = LoggerFactory.getLogger(SizeCache.class);

	private final Duration ttl;
	private final int capacity;
	private final int evictCount;
	private final Clock clock;
	private final Map<String, Entry> entries = new LinkedHashMap<>();

	public SizeCache(Duration ttl, int capacity) {
		this(ttl, capacity, Clock.systemUTC());
	}

	public SizeCache(Duration ttl, int capacity, Clock clock) {
		this.ttl = ttl;
		this.capacity = capacity;
		this.evictCount = capacity / 2;
		this.clock = clock;
	}

	/**
	 * Get a cached size.
	 *
	 * @param key The attachment identifier
	 * @return The cached size, or empty if absent or expired
	 */
	public synchronized OptionalLong get(String key) {
		Entry entry = entries.get(key);
		if (entry == null) {
			return OptionalLong.empty();
		}
		if (isExpired(entry, clock.instant())) {
			entries.remove(key);
			return OptionalLong.empty();
		}
		return OptionalLong.of(entry.value());
	}

	/**
	 * Get a cached size, asking the remote on a miss and caching the answer. The lookup runs
	 * outside the cache lock, so two concurrent misses for the same key may both hit the remote.
	 */
	public long get(String key, SizeLookup lookup) throws IOException, InterruptedException {
		OptionalLong cached = get(key);
		if (cached.isPresent()) {
			return cached.getAsLong();
		}
		long size = lookup.lookupSize(key);
		put(key, size);
		return size;
	}

	public synchronized void put(String key, long value) {
		// Re-inserting moves the key to the end of the insertion order
		entries.remove(key);
		entries.put(key, new Entry(value, clock.instant()));
		if (entries.size() > capacity) {
			evictOldest();
		}
	}

	public synchronized void invalidate(String key) {
		entries.remove(key);
	}

	public synchronized int size() {
		return entries.size();
	}

	public synchronized boolean containsKey(String key) {
		return entries.containsKey(key);
	}

	private void evictOldest() {
		List<String> oldest = entries.entrySet().stream()
				.sorted(Comparator.comparing(e -> e.getValue().insertedAt()))
				.limit(evictCount)
				.map(Map.Entry::getKey)
				.toList();
		oldest.forEach(entries::remove);
		logger.debug("Evicted {} cached sizes, {} left", oldest.size(), entries.size());
	}

	private boolean isExpired(Entry entry, Instant now) {
		return Duration.between(entry.insertedAt(), now).compareTo(ttl) > 0;
	}

	private record Entry(long value, Instant insertedAt) {}
}
