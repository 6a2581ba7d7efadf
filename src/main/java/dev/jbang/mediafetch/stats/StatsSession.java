package dev.jbang.mediafetch.stats;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Counters for one download operation. They become part of the long-lived totals exactly once,
 * when the session is closed; closing again has no effect.
 */
public class StatsSession implements AutoCloseable {
	private final StatsCollector collector;
	private final Counters counters = new Counters();
	private final AtomicBoolean closed = new AtomicBoolean(false);

	StatsSession(StatsCollector collector) {
		this.collector = collector;
	}

	/** A fetch was made, whatever its outcome */
	public void recordAttempt() {
		counters.attempts.incrementAndGet();
	}

	public void recordSuccess(long bytesWritten) {
		counters.successes.incrementAndGet();
		counters.bytes.addAndGet(Math.max(0, bytesWritten));
	}

	/** A task failed for good (permanent or retries exhausted) */
	public void recordFailure() {
		counters.failures.incrementAndGet();
	}

	public void recordFloodWait() {
		counters.floodWaits.incrementAndGet();
	}

	public void recordSkipped() {
		counters.skipped.incrementAndGet();
	}

	public long successfulDownloads() {
		return counters.successes.get();
	}

	public long totalAttempts() {
		return counters.attempts.get();
	}

	public boolean isClosed() {
		return closed.get();
	}

	Counters counters() {
		return counters;
	}

	@Override
	public void close() {
		if (closed.compareAndSet(false, true)) {
			collector.fold(this);
		}
	}
}
