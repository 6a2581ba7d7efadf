package dev.jbang.mediafetch.stats;

import java.util.concurrent.atomic.AtomicLong;

/** Plain set of monotonic counters shared by sessions and the long-lived totals */
class Counters {
	final AtomicLong attempts = new AtomicLong();
	final AtomicLong successes = new AtomicLong();
	final AtomicLong failures = new AtomicLong();
	final AtomicLong skipped = new AtomicLong();
	final AtomicLong floodWaits = new AtomicLong();
	final AtomicLong bytes = new AtomicLong();

	void addTo(Counters target) {
		target.attempts.addAndGet(attempts.get());
		target.successes.addAndGet(successes.get());
		target.failures.addAndGet(failures.get());
		target.skipped.addAndGet(skipped.get());
		target.floodWaits.addAndGet(floodWaits.get());
		target.bytes.addAndGet(bytes.get());
	}
}
