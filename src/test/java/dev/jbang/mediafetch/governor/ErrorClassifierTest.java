package dev.jbang.mediafetch.governor;

import static org.assertj.core.api.Assertions.*;

import dev.jbang.mediafetch.fetch.FloodWaitException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ErrorClassifierTest {

	private final ErrorClassifier classifier = new ErrorClassifier();

	@Test
	void testFloodWait() {
		// When
		Classification result = classifier.classify(new FloodWaitException(Duration.ofSeconds(12)));

		// Then
		assertThat(result.kind()).isEqualTo(ErrorKind.FLOOD_WAIT);
		assertThat(result.isFloodWait()).isTrue();
		assertThat(result.waitSeconds()).isEqualTo(12.0);
		assertThat(result.toString()).isEqualTo("FLOOD_WAIT(12.0s)");
	}

	@Test
	void testWrappedFloodWait() {
		// Given
		IOException cause = new FloodWaitException("Too many requests", Duration.ofMillis(2500));
		RuntimeException wrapped = new RuntimeException("access problem", new UncheckedIOException(cause));

		// When
		Classification result = classifier.classify(wrapped);

		// Then
		assertThat(result.kind()).isEqualTo(ErrorKind.FLOOD_WAIT);
		assertThat(result.waitSeconds()).isEqualTo(2.5);
	}

	@Test
	void testNetworkMessages() {
		assertThat(classifier.classify(new IOException("Connection reset by peer")))
				.isEqualTo(Classification.NETWORK);
		assertThat(classifier.classify(new IOException("NETWORK is unreachable")))
				.isEqualTo(Classification.NETWORK);
	}

	@Test
	void testPermissionMessages() {
		assertThat(classifier.classify(new IOException("Access denied - HTTP status: 403")))
				.isEqualTo(Classification.PERMISSION);
		assertThat(classifier.classify(new IllegalStateException("No Permission for this chat")))
				.isEqualTo(Classification.PERMISSION);
	}

	@Test
	void testNetworkWinsOverPermission() {
		// When
		Classification result = classifier.classify(new IOException("network access lost"));

		// Then
		assertThat(result).isEqualTo(Classification.NETWORK);
	}

	@Test
	void testUnknown() {
		assertThat(classifier.classify(new IOException("Disk full"))).isEqualTo(Classification.UNKNOWN);
		assertThat(classifier.classify(new NullPointerException())).isEqualTo(Classification.UNKNOWN);
		assertThat(classifier.classify(null)).isEqualTo(Classification.UNKNOWN);
	}

	@Test
	void testOnlyTopLevelMessageIsMatched() {
		// When
		Classification result =
				classifier.classify(new RuntimeException("Download failed", new IOException("Connection refused")));

		// Then
		assertThat(result).isEqualTo(Classification.UNKNOWN);
	}

	@Test
	void testMisbehavingExceptionIsUnknown() {
		// Given
		RuntimeException broken = new RuntimeException() {
			@Override
			public String getMessage() {
				throw new IllegalStateException("boom");
			}
		};

		// When
		Classification result = classifier.classify(broken);

		// Then
		assertThat(result).isEqualTo(Classification.UNKNOWN);
	}

	@Test
	void testCyclicCauseChain() {
		// Given
		CyclicException first = new CyclicException("first");
		CyclicException second = new CyclicException("second");
		first.cause = second;
		second.cause = first;

		// When
		Classification result = classifier.classify(first);

		// Then
		assertThat(result).isEqualTo(Classification.UNKNOWN);
	}

	private static class CyclicException extends RuntimeException {
		Throwable cause;

		CyclicException(String message) {
			super(message);
		}

		@Override
		public synchronized Throwable getCause() {
			return cause;
		}
	}
}
