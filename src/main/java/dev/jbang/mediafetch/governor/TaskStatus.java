package dev.jbang.mediafetch.governor;

/** Status of a task after a dispatch */
public enum TaskStatus {
	SUCCEEDED,
	/** Destination already present with the expected size, nothing fetched */
	SKIPPED,
	/** Failed, but will be tried again in a later batch */
	RETRYABLE,
	PERMANENT,
	/** Retryable failures used up all attempts */
	EXHAUSTED,
	CANCELLED;

	public boolean isTerminal() {
		return this != RETRYABLE;
	}

	/** Whether the destination file of a task with this status can be trusted */
	public boolean isValidFile() {
		return this == SUCCEEDED || this == SKIPPED;
	}
}
