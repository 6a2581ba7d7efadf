package dev.jbang.mediafetch.governor;

import java.time.Duration;

/**
 * Construction-time settings for a {@link DownloadScheduler}. All values are validated when the
 * config is created; out of range values fail with an {@link IllegalArgumentException} instead of
 * being clamped.
 *
 * @param maxWorkers Upper bound for concurrent fetches (1..32)
 * @param initialWorkers Concurrency used for the first batch (1..16, at most maxWorkers)
 * @param minDelay Lower bound of the adaptive pre-dispatch delay, in seconds
 * @param maxDelay Upper bound of the adaptive pre-dispatch delay, in seconds
 * @param initialDelay Starting adaptive delay, in seconds
 * @param cacheTtl Maximum age of a cached size lookup
 * @param cacheCapacity Number of cached sizes that triggers bulk eviction of the older half
 * @param maxRetries Number of attempts after which a retryable task is given up on
 */
public record GovernorConfig(
		int maxWorkers,
		int initialWorkers,
		double minDelay,
		double maxDelay,
		double initialDelay,
		Duration cacheTtl,
		int cacheCapacity,
		int maxRetries) {

	public static final int MAX_WORKERS_LIMIT = 32;
	public static final int INITIAL_WORKERS_LIMIT = 16;

	public static final int DEFAULT_MAX_WORKERS = 8;
	public static final int DEFAULT_INITIAL_WORKERS = 4;
	public static final double DEFAULT_MIN_DELAY = 0.1;
	public static final double DEFAULT_MAX_DELAY = 3.0;
	public static final double DEFAULT_INITIAL_DELAY = 0.5;
	public static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(300);
	public static final int DEFAULT_CACHE_CAPACITY = 100;
	public static final int DEFAULT_MAX_RETRIES = 3;

	public GovernorConfig {
		if (maxWorkers < 1 || maxWorkers > MAX_WORKERS_LIMIT) {
			throw new IllegalArgumentException(
					"maxWorkers must be between 1 and " + MAX_WORKERS_LIMIT + ", was " + maxWorkers);
		}
		if (initialWorkers < 1 || initialWorkers > INITIAL_WORKERS_LIMIT) {
			throw new IllegalArgumentException(
					"initialWorkers must be between 1 and " + INITIAL_WORKERS_LIMIT + ", was " + initialWorkers);
		}
		if (initialWorkers > maxWorkers) {
			throw new IllegalArgumentException(
					"initialWorkers (" + initialWorkers + ") must not exceed maxWorkers (" + maxWorkers + ")");
		}
		if (!Double.isFinite(minDelay) || minDelay < 0) {
			throw new IllegalArgumentException("minDelay must be a non-negative number, was " + minDelay);
		}
		if (!Double.isFinite(maxDelay) || maxDelay < minDelay) {
			throw new IllegalArgumentException(
					"maxDelay (" + maxDelay + ") must be a number not smaller than minDelay (" + minDelay + ")");
		}
		if (!Double.isFinite(initialDelay) || initialDelay < minDelay || initialDelay > maxDelay) {
			throw new IllegalArgumentException("initialDelay (" + initialDelay + ") must be between minDelay ("
					+ minDelay + ") and maxDelay (" + maxDelay + ")");
		}
		if (cacheTtl == null || cacheTtl.isZero() || cacheTtl.isNegative()) {
			throw new IllegalArgumentException("cacheTtl must be a positive duration, was " + cacheTtl);
		}
		if (cacheCapacity < 2) {
			throw new IllegalArgumentException("cacheCapacity must be at least 2, was " + cacheCapacity);
		}
		if (maxRetries < 1) {
			throw new IllegalArgumentException("maxRetries must be at least 1, was " + maxRetries);
		}
	}

	public static GovernorConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {
		private int maxWorkers = DEFAULT_MAX_WORKERS;
		private int initialWorkers = DEFAULT_INITIAL_WORKERS;
		private double minDelay = DEFAULT_MIN_DELAY;
		private double maxDelay = DEFAULT_MAX_DELAY;
		private Double initialDelay;
		private Duration cacheTtl = DEFAULT_CACHE_TTL;
		private int cacheCapacity = DEFAULT_CACHE_CAPACITY;
		private int maxRetries = DEFAULT_MAX_RETRIES;

		private Builder() {}

		public Builder maxWorkers(int maxWorkers) {
			this.maxWorkers = maxWorkers;
			return this;
		}

		public Builder initialWorkers(int initialWorkers) {
			this.initialWorkers = initialWorkers;
			return this;
		}

		public Builder minDelay(double minDelay) {
			this.minDelay = minDelay;
			return this;
		}

		public Builder maxDelay(double maxDelay) {
			this.maxDelay = maxDelay;
			return this;
		}

		public Builder initialDelay(double initialDelay) {
			this.initialDelay = initialDelay;
			return this;
		}

		public Builder cacheTtl(Duration cacheTtl) {
			this.cacheTtl = cacheTtl;
			return this;
		}

		public Builder cacheCapacity(int cacheCapacity) {
			this.cacheCapacity = cacheCapacity;
			return this;
		}

		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		/**
		 * Build the config. When no initial delay was given the default is used, pulled into the
		 * configured delay bounds.
		 */
		public GovernorConfig build() {
			double delay = initialDelay != null
					? initialDelay
					: Math.min(Math.max(DEFAULT_INITIAL_DELAY, minDelay), Math.max(minDelay, maxDelay));
			return new GovernorConfig(
					maxWorkers, initialWorkers, minDelay, maxDelay, delay, cacheTtl, cacheCapacity, maxRetries);
		}
	}
}
