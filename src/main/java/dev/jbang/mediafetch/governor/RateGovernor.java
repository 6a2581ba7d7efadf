package dev.jbang.mediafetch.governor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the adaptive concurrency and delay used for dispatching fetches, and the two rules that
 * adjust them.
 *
 * <p>Throttle signals back off multiplicatively, scaled by how long the remote asked us to wait.
 * Success streaks relax the delay slowly, and only once the endpoint has been quiet for a while.
 * The adjustment methods are meant to be called from a single thread (the scheduler's completion
 * handling); they are synchronized so that snapshots can be read from anywhere.
 */
public class RateGovernor {
	private static final Logger logger = LoggerFactory.getLogger(RateGovernor.class);

	static final Duration QUIET_WINDOW = Duration.ofSeconds(120);
	static final int RELAX_AFTER_SUCCESSES = 15;
	static final int GROW_EVERY_SUCCESSES = 20;
	static final double RELAX_FACTOR = 0.95;
	static final double JITTER_MIN = 0.8;
	static final double JITTER_MAX = 1.2;

	private final int maxWorkers;
	private final double minDelay;
	private final double maxDelay;
	private final Clock clock;
	private final Random random;

	private int currentWorkers;
	private double adaptiveDelay;
	private int consecutiveSuccesses;
	private Instant lastThrottle;

	public RateGovernor(GovernorConfig config) {
		this(config, Clock.systemUTC(), new Random());
	}

	public RateGovernor(GovernorConfig config, Clock clock, Random random) {
		this.maxWorkers = config.maxWorkers();
		this.minDelay = config.minDelay();
		this.maxDelay = config.maxDelay();
		this.clock = clock;
		this.random = random;
		this.currentWorkers = config.initialWorkers();
		this.adaptiveDelay = config.initialDelay();
		this.consecutiveSuccesses = 0;
		// The quiet window starts counting from creation until a real throttle happens
		this.lastThrottle = clock.instant();
	}

	/**
	 * React to a flood wait signal from the remote endpoint.
	 *
	 * @param waitSeconds The cool-down the remote demanded, in seconds
	 */
	public synchronized void onThrottle(double waitSeconds) {
		double multiplier = throttleMultiplier(waitSeconds);
		double previousDelay = adaptiveDelay;
		int previousWorkers = currentWorkers;

		adaptiveDelay = Math.min(maxDelay, adaptiveDelay * multiplier);
		currentWorkers = Math.max(1, currentWorkers - 1);
		consecutiveSuccesses = 0;
		lastThrottle = clock.instant();

		logger.warn(
				"Throttled for {}s - delay {}s -> {}s, workers {} -> {}",
				waitSeconds,
				format(previousDelay),
				format(adaptiveDelay),
				previousWorkers,
				currentWorkers);
	}

	/** Record one successfully completed fetch. */
	public synchronized void onSuccess() {
		consecutiveSuccesses++;

		Duration sinceThrottle = Duration.between(lastThrottle, clock.instant());
		if (sinceThrottle.compareTo(QUIET_WINDOW) > 0 && consecutiveSuccesses >= RELAX_AFTER_SUCCESSES) {
			adaptiveDelay = Math.max(minDelay, adaptiveDelay * RELAX_FACTOR);
			if (consecutiveSuccesses % GROW_EVERY_SUCCESSES == 0) {
				int previousWorkers = currentWorkers;
				currentWorkers = Math.min(maxWorkers, currentWorkers + 1);
				if (currentWorkers != previousWorkers) {
					logger.info(
							"Stable for {} downloads - workers {} -> {}",
							consecutiveSuccesses,
							previousWorkers,
							currentWorkers);
				}
			}
			logger.debug("Relaxed delay to {}s after {} successes", format(adaptiveDelay), consecutiveSuccesses);
		}
	}

	/** Record a failed fetch that was not a throttle signal. Only the success streak is affected. */
	public synchronized void onFailure() {
		consecutiveSuccesses = 0;
	}

	/**
	 * The delay to wait before the next dispatch: the adaptive delay with a fresh random jitter in
	 * [0.8, 1.2] so concurrently scheduled fetches don't hit the endpoint in lockstep.
	 *
	 * @return Delay in seconds
	 */
	public synchronized double nextDelay() {
		double jitter = JITTER_MIN + random.nextDouble() * (JITTER_MAX - JITTER_MIN);
		return adaptiveDelay * jitter;
	}

	public synchronized int currentWorkers() {
		return currentWorkers;
	}

	public synchronized double adaptiveDelay() {
		return adaptiveDelay;
	}

	public synchronized int consecutiveSuccesses() {
		return consecutiveSuccesses;
	}

	public synchronized GovernorSnapshot snapshot() {
		return new GovernorSnapshot(currentWorkers, adaptiveDelay, consecutiveSuccesses, lastThrottle);
	}

	/** Backoff multiplier for a throttle of the given severity */
	static double throttleMultiplier(double waitSeconds) {
		if (waitSeconds > 10) {
			return 2.0;
		} else if (waitSeconds > 5) {
			return 1.8;
		}
		return 1.5;
	}

	private static String format(double seconds) {
		return String.format(Locale.ROOT, "%.3f", seconds);
	}
}
