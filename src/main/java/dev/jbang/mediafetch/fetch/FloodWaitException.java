package dev.jbang.mediafetch.fetch;

import java.io.IOException;
import java.time.Duration;

/** Raised when the remote endpoint suspends the caller for a mandatory cool-down period */
public class FloodWaitException extends IOException {
	private final Duration waitDuration;

	public FloodWaitException(Duration waitDuration) {
		this("Flood wait of " + waitDuration.toSeconds() + "s requested", waitDuration);
	}

	public FloodWaitException(String message, Duration waitDuration) {
		super(message);
		this.waitDuration = waitDuration;
	}

	public Duration getWaitDuration() {
		return waitDuration;
	}

	/** The wait duration in (fractional) seconds */
	public double getWaitSeconds() {
		return waitDuration.toMillis() / 1000.0;
	}
}
