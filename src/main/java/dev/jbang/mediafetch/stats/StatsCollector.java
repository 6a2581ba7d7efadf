package dev.jbang.mediafetch.stats;

import dev.jbang.mediafetch.governor.GovernorSnapshot;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Long-lived download statistics. Each download operation records into its own {@link
 * StatsSession}; snapshots combine the folded totals with all sessions still open.
 */
public class StatsCollector {
	private static final double BYTES_PER_MEGABYTE = 1024.0 * 1024.0;

	private final Clock clock;
	private final Instant startedAt;
	private final Counters totals = new Counters();
	private final Set<StatsSession> openSessions = new LinkedHashSet<>();

	public StatsCollector() {
		this(Clock.systemUTC());
	}

	public StatsCollector(Clock clock) {
		this.clock = clock;
		this.startedAt = clock.instant();
	}

	public synchronized StatsSession openSession() {
		StatsSession session = new StatsSession(this);
		openSessions.add(session);
		return session;
	}

	synchronized void fold(StatsSession session) {
		if (openSessions.remove(session)) {
			session.counters().addTo(totals);
		}
	}

	/**
	 * Compute a snapshot.
	 *
	 * @param governor Current governor state to include
	 * @param pendingTasks Tasks waiting for a batch
	 * @return The statistics as of now
	 */
	public synchronized DownloadStats snapshot(GovernorSnapshot governor, int pendingTasks) {
		Counters current = new Counters();
		totals.addTo(current);
		for (StatsSession session : openSessions) {
			session.counters().addTo(current);
		}

		long attempts = current.attempts.get();
		long successes = current.successes.get();
		long floodWaits = current.floodWaits.get();
		long bytes = current.bytes.get();

		double successRate = attempts == 0 ? 0 : successes * 100.0 / attempts;
		double floodWaitRate = attempts == 0 ? 0 : floodWaits * 100.0 / attempts;

		double elapsedSeconds = Duration.between(startedAt, clock.instant()).toMillis() / 1000.0;
		double downloadsPerMinute = elapsedSeconds <= 0 ? 0 : successes / (elapsedSeconds / 60.0);
		double filesPerSecond = elapsedSeconds <= 0 ? 0 : successes / elapsedSeconds;
		double megabytesPerSecond = elapsedSeconds <= 0 ? 0 : bytes / BYTES_PER_MEGABYTE / elapsedSeconds;

		return new DownloadStats(
				attempts,
				successes,
				current.failures.get(),
				current.skipped.get(),
				floodWaits,
				bytes,
				successRate,
				floodWaitRate,
				downloadsPerMinute,
				filesPerSecond,
				megabytesPerSecond,
				governor.currentWorkers(),
				governor.adaptiveDelay(),
				governor.consecutiveSuccesses(),
				pendingTasks);
	}

	public Instant startedAt() {
		return startedAt;
	}
}
