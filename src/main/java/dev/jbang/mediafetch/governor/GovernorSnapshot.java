package dev.jbang.mediafetch.governor;

import java.time.Instant;

/** Point-in-time copy of the adaptive state held by a {@link RateGovernor} */
public record GovernorSnapshot(
		int currentWorkers, double adaptiveDelay, int consecutiveSuccesses, Instant lastThrottle) {}
