package dev.jbang.mediafetch.governor;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Result of one dispatch of a {@link DownloadTask}.
 *
 * @param taskId The task identifier
 * @param status What happened
 * @param bytesWritten Bytes written to the destination (or found there for skipped tasks)
 * @param elapsed Wall-clock time of the attempt, backoff included
 * @param error Classified failure, null on success
 * @param errorMessage Message of the raw failure, null on success
 * @param attempts Number of dispatches so far
 * @param destination The destination file
 */
public record TaskOutcome(
		String taskId,
		TaskStatus status,
		long bytesWritten,
		Duration elapsed,
		Classification error,
		String errorMessage,
		int attempts,
		Path destination) {

	public static TaskOutcome succeeded(DownloadTask task, long bytesWritten, Duration elapsed) {
		return new TaskOutcome(
				task.taskId(),
				TaskStatus.SUCCEEDED,
				bytesWritten,
				elapsed,
				null,
				null,
				task.attempts(),
				task.destination());
	}

	public static TaskOutcome skipped(DownloadTask task, long existingBytes, Duration elapsed) {
		return new TaskOutcome(
				task.taskId(), TaskStatus.SKIPPED, existingBytes, elapsed, null, null, task.attempts(), task.destination());
	}

	public static TaskOutcome failed(
			DownloadTask task, TaskStatus status, Classification error, String errorMessage, Duration elapsed) {
		return new TaskOutcome(
				task.taskId(), status, 0, elapsed, error, errorMessage, task.attempts(), task.destination());
	}

	public static TaskOutcome cancelled(DownloadTask task, Duration elapsed) {
		return new TaskOutcome(
				task.taskId(), TaskStatus.CANCELLED, 0, elapsed, null, "Cancelled", task.attempts(), task.destination());
	}

	public TaskOutcome withStatus(TaskStatus newStatus) {
		return new TaskOutcome(taskId, newStatus, bytesWritten, elapsed, error, errorMessage, attempts, destination);
	}

	public boolean isFailure() {
		return !status.isValidFile();
	}

	@Override
	public String toString() {
		if (error == null) {
			return "%s %s (%d bytes, %d attempts)".formatted(taskId, status, bytesWritten, attempts);
		}
		return "%s %s - %s: %s (%d attempts)".formatted(taskId, status, error, errorMessage, attempts);
	}
}
