package dev.jbang.mediafetch.stats;

import java.util.Locale;

/**
 * Read-only statistics snapshot. Rates are percentages of all fetch attempts and are 0 while no
 * attempt has been made.
 */
public record DownloadStats(
		long totalAttempts,
		long successfulDownloads,
		long failedDownloads,
		long skippedDownloads,
		long floodWaits,
		long bytesDownloaded,
		double successRate,
		double floodWaitRate,
		double downloadsPerMinute,
		double filesPerSecond,
		double megabytesPerSecond,
		int currentWorkers,
		double adaptiveDelay,
		int consecutiveSuccesses,
		int pendingTasks) {

	@Override
	public String toString() {
		return String.format(
				Locale.ROOT,
				"%d attempts, %d downloaded, %d failed, %d skipped, %d flood waits | success %.1f%%, flood waits %.1f%%"
						+ " | %.1f/min, %.2f MB/s | %d workers, %.2fs delay, %d pending",
				totalAttempts,
				successfulDownloads,
				failedDownloads,
				skippedDownloads,
				floodWaits,
				successRate,
				floodWaitRate,
				downloadsPerMinute,
				megabytesPerSecond,
				currentWorkers,
				adaptiveDelay,
				pendingTasks);
	}
}
