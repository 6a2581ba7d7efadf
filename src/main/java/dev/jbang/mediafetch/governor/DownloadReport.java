package dev.jbang.mediafetch.governor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Summary of one {@link DownloadScheduler#submit} call */
public record DownloadReport(
		int succeeded,
		int skipped,
		int permanent,
		int exhausted,
		int cancelled,
		Map<String, Path> downloadedFiles,
		List<TaskOutcome> failures) {

	public DownloadReport {
		downloadedFiles = Map.copyOf(downloadedFiles);
		failures = List.copyOf(failures);
	}

	/** Total number of tasks that reached a terminal status */
	public int total() {
		return succeeded + skipped + permanent + exhausted + cancelled;
	}

	public int failed() {
		return permanent + exhausted;
	}

	/**
	 * Look up the file a task produced.
	 *
	 * @param taskId The task identifier
	 * @return The destination file if the task succeeded or was skipped
	 */
	public Optional<Path> downloadedFile(String taskId) {
		return Optional.ofNullable(downloadedFiles.get(taskId));
	}

	@Override
	public String toString() {
		return "%d downloaded, %d skipped, %d failed permanently, %d exhausted retries, %d cancelled"
				.formatted(succeeded, skipped, permanent, exhausted, cancelled);
	}

	static class Builder {
		private int succeeded;
		private int skipped;
		private int permanent;
		private int exhausted;
		private int cancelled;
		private final Map<String, Path> downloadedFiles = new LinkedHashMap<>();
		private final List<TaskOutcome> failures = new ArrayList<>();

		void add(TaskOutcome outcome) {
			switch (outcome.status()) {
				case SUCCEEDED -> succeeded++;
				case SKIPPED -> skipped++;
				case PERMANENT -> permanent++;
				case EXHAUSTED -> exhausted++;
				case CANCELLED -> cancelled++;
				case RETRYABLE -> throw new IllegalArgumentException("Not a terminal outcome: " + outcome);
			}
			if (outcome.status().isValidFile()) {
				downloadedFiles.put(outcome.taskId(), outcome.destination());
			} else if (outcome.status() != TaskStatus.CANCELLED) {
				failures.add(outcome);
			}
		}

		DownloadReport build() {
			return new DownloadReport(succeeded, skipped, permanent, exhausted, cancelled, downloadedFiles, failures);
		}
	}
}
