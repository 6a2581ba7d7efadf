package dev.jbang.mediafetch.governor;

import static org.assertj.core.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SizeCacheTest {

	private MutableClock clock;
	private SizeCache cache;

	@BeforeEach
	void setUp() {
		clock = new MutableClock();
		cache = new SizeCache(Duration.ofSeconds(300), 100, clock);
	}

	@Test
	void testPutAndGet() {
		// When
		cache.put("a", 1234);

		// Then
		assertThat(cache.get("a")).hasValue(1234);
		assertThat(cache.get("b")).isEmpty();
	}

	@Test
	void testEntriesExpireAfterTtl() {
		// Given
		cache.put("a", 1);

		// When
		clock.advanceSeconds(299);

		// Then
		assertThat(cache.get("a")).hasValue(1);

		// When
		clock.advanceSeconds(2);

		// Then
		assertThat(cache.get("a")).isEmpty();
		assertThat(cache.containsKey("a")).isFalse();
	}

	@Test
	void testEntryExactlyAtTtlIsStillValid() {
		// Given
		cache.put("a", 1);

		// When
		clock.advanceSeconds(300);

		// Then
		assertThat(cache.get("a")).hasValue(1);
	}

	@Test
	void testOverflowEvictsOlderHalf() {
		// Given
		for (int i = 0; i < 100; i++) {
			cache.put("key" + i, i);
			clock.advance(Duration.ofMillis(10));
		}
		assertThat(cache.size()).isEqualTo(100);

		// When
		cache.put("key100", 100);

		// Then
		assertThat(cache.size()).isEqualTo(51);
		for (int i = 0; i < 50; i++) {
			assertThat(cache.containsKey("key" + i)).as("key%d", i).isFalse();
		}
		for (int i = 50; i <= 100; i++) {
			assertThat(cache.get("key" + i)).as("key%d", i).hasValue(i);
		}
	}

	@Test
	void testOverflowWithIdenticalTimestampsKeepsInsertionOrder() {
		// Given
		SizeCache small = new SizeCache(Duration.ofSeconds(300), 4, clock);
		for (int i = 0; i < 5; i++) {
			small.put("key" + i, i);
		}

		// Then
		assertThat(small.size()).isEqualTo(3);
		assertThat(small.containsKey("key0")).isFalse();
		assertThat(small.containsKey("key1")).isFalse();
		assertThat(small.containsKey("key4")).isTrue();
	}

	@Test
	void testReinsertRefreshesEntry() {
		// Given
		cache.put("a", 1);
		clock.advanceSeconds(200);

		// When
		cache.put("a", 2);
		clock.advanceSeconds(200);

		// Then
		assertThat(cache.get("a")).hasValue(2);
		assertThat(cache.size()).isEqualTo(1);
	}

	@Test
	void testLookupOnMissOnly() throws Exception {
		// Given
		AtomicInteger lookups = new AtomicInteger();

		// When
		long first = cache.get("a", key -> {
			lookups.incrementAndGet();
			return 4096;
		});
		long second = cache.get("a", key -> {
			lookups.incrementAndGet();
			return 1;
		});

		// Then
		assertThat(first).isEqualTo(4096);
		assertThat(second).isEqualTo(4096);
		assertThat(lookups.get()).isEqualTo(1);
	}

	@Test
	void testConcurrentAccessStaysWithinCapacity() throws Exception {
		// Given
		int threads = 8;
		int keysPerThread = 500;
		ExecutorService executor = Executors.newFixedThreadPool(threads);
		CountDownLatch start = new CountDownLatch(1);
		AtomicInteger maxSize = new AtomicInteger();
		List<Future<?>> futures = new ArrayList<>();

		// When
		try {
			for (int t = 0; t < threads; t++) {
				int thread = t;
				futures.add(executor.submit(() -> {
					start.await();
					for (int i = 0; i < keysPerThread; i++) {
						String key = "key-" + thread + "-" + i;
						cache.put(key, i);
						cache.get(key);
						cache.get("key-" + ((thread + 1) % threads) + "-" + i);
						maxSize.accumulateAndGet(cache.size(), Math::max);
					}
					return null;
				}));
			}
			start.countDown();
			for (Future<?> future : futures) {
				future.get(30, TimeUnit.SECONDS);
			}
		} finally {
			executor.shutdownNow();
		}

		// Then
		assertThat(maxSize.get()).isLessThanOrEqualTo(100);
		assertThat(cache.size()).isBetween(1, 100);
	}

	@Test
	void testInvalidate() {
		// Given
		cache.put("a", 1);

		// When
		cache.invalidate("a");

		// Then
		assertThat(cache.get("a")).isEmpty();
	}
}
