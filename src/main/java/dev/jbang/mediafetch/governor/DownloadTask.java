package dev.jbang.mediafetch.governor;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A pending attachment download. Everything except the attempt count is fixed at creation; the
 * attempt count is only advanced by the scheduler thread right before a dispatch.
 */
public final class DownloadTask {
	private final String taskId;
	private final String mediaRef;
	private final Path destination;
	private int attempts;
	private volatile boolean destinationWritten;

	public DownloadTask(String taskId, String mediaRef, Path destination) {
		this.taskId = Objects.requireNonNull(taskId, "taskId");
		this.mediaRef = Objects.requireNonNull(mediaRef, "mediaRef");
		this.destination = Objects.requireNonNull(destination, "destination");
	}

	public String taskId() {
		return taskId;
	}

	public String mediaRef() {
		return mediaRef;
	}

	public Path destination() {
		return destination;
	}

	public int attempts() {
		return attempts;
	}

	int recordAttempt() {
		return ++attempts;
	}

	/** Whether a dispatch of this task created or changed the destination file */
	boolean destinationWritten() {
		return destinationWritten;
	}

	void markDestinationWritten() {
		destinationWritten = true;
	}

	@Override
	public String toString() {
		return "DownloadTask[" + taskId + " -> " + destination + ", attempts=" + attempts + "]";
	}
}
