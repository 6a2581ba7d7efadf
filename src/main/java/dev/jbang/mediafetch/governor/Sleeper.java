package dev.jbang.mediafetch.governor;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/** Suspends the calling thread. Replaced in tests to avoid real waiting. */
@FunctionalInterface
public interface Sleeper {
	Sleeper SYSTEM = duration -> {
		if (!duration.isNegative() && !duration.isZero()) {
			TimeUnit.NANOSECONDS.sleep(duration.toNanos());
		}
	};

	void sleep(Duration duration) throws InterruptedException;
}
