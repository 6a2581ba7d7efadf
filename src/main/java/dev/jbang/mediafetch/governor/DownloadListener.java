package dev.jbang.mediafetch.governor;

import dev.jbang.mediafetch.stats.DownloadStats;

/** Receives results while a {@link DownloadScheduler} works through a task sequence */
public interface DownloadListener {
	DownloadListener NONE = new DownloadListener() {};

	/**
	 * Called once per task when it reaches a terminal status. Called from the scheduling thread.
	 *
	 * @param outcome The terminal outcome
	 */
	default void onOutcome(TaskOutcome outcome) {}

	/**
	 * Called after every batch barrier.
	 *
	 * @param batchNumber 1-based batch counter for the current submission
	 * @param stats Statistics including the current submission
	 */
	default void onBatchCompleted(int batchNumber, DownloadStats stats) {}
}
