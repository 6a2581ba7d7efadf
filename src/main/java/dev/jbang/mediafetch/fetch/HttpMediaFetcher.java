package dev.jbang.mediafetch.fetch;

import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches attachments over HTTP. All fetches share a single {@link HttpClient}. There is no retry
 * in here, the scheduler owns retries; instead HTTP failures are translated into errors the
 * scheduler can classify:
 *
 * <ul>
 *   <li>429 becomes a {@link FloodWaitException} with the wait from {@code Retry-After}
 *   <li>401 and 403 become an "Access denied" error
 *   <li>connect failures and 502/503/504 become "connection" or "network" errors
 * </ul>
 *
 * Bodies are streamed into a {@code .part} file next to the destination that is moved into place
 * only after it was completely written and closed.
 */
public class HttpMediaFetcher implements MediaFetcher, SizeLookup {
	private static final Logger logger = LoggerFactory.getLogger(HttpMediaFetcher.class);

	public static final String PART_SUFFIX = ".part";
	static final Duration DEFAULT_FLOOD_WAIT = Duration.ofSeconds(5);

	private final HttpClient httpClient;
	private final Duration requestTimeout;
	private final Clock clock;

	public HttpMediaFetcher() {
		this(Duration.ofSeconds(30), Duration.ofMinutes(10));
	}

	public HttpMediaFetcher(Duration connectTimeout, Duration requestTimeout) {
		this(
				HttpClient.newBuilder()
						.followRedirects(HttpClient.Redirect.NORMAL)
						.connectTimeout(connectTimeout)
						.build(),
				requestTimeout,
				Clock.systemUTC());
	}

	HttpMediaFetcher(HttpClient httpClient, Duration requestTimeout, Clock clock) {
		this.httpClient = httpClient;
		this.requestTimeout = requestTimeout;
		this.clock = clock;
	}

	/** Download a URL to a local path */
	@Override
	public long fetch(String url, Path destination) throws IOException, InterruptedException {
		HttpResponse<InputStream> response =
				send(request(url).GET().build(), HttpResponse.BodyHandlers.ofInputStream());
		if (!isSuccess(response.statusCode())) {
			response.body().close();
			throw statusError(response.statusCode(), response.headers());
		}

		Path partFile = partFile(destination);
		try {
			long bytes;
			try (InputStream inputStream = response.body()) {
				bytes = Files.copy(inputStream, partFile, StandardCopyOption.REPLACE_EXISTING);
			}
			Files.move(partFile, destination, StandardCopyOption.REPLACE_EXISTING);

			// Preserve original file timestamp from Last-Modified header if available
			response.headers().firstValue("Last-Modified").ifPresent(lastModified -> {
				try {
					Instant instant = Instant.from(DateTimeFormatter.RFC_1123_DATE_TIME.parse(lastModified));
					Files.setLastModifiedTime(destination, FileTime.from(instant));
				} catch (DateTimeParseException | IOException e) {
					logger.debug("Could not apply Last-Modified '{}' to {}", lastModified, destination);
				}
			});
			return bytes;
		} finally {
			Files.deleteIfExists(partFile);
		}
	}

	/** Remote size from the Content-Length of a HEAD request, -1 if the server doesn't say */
	@Override
	public long lookupSize(String url) throws IOException, InterruptedException {
		HttpRequest request = request(url)
				.method("HEAD", HttpRequest.BodyPublishers.noBody())
				.build();
		HttpResponse<Void> response = send(request, HttpResponse.BodyHandlers.discarding());
		if (!isSuccess(response.statusCode())) {
			throw statusError(response.statusCode(), response.headers());
		}
		return response.headers().firstValueAsLong("Content-Length").orElse(-1);
	}

	public static Path partFile(Path destination) {
		return destination.resolveSibling(destination.getFileName() + PART_SUFFIX);
	}

	private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler)
			throws IOException, InterruptedException {
		try {
			return httpClient.send(request, handler);
		} catch (ConnectException | HttpConnectTimeoutException e) {
			throw new IOException("Connection failed: " + e.getMessage(), e);
		} catch (HttpTimeoutException e) {
			throw new IOException("Network timeout: " + e.getMessage(), e);
		}
	}

	private HttpRequest.Builder request(String url) {
		return HttpRequest.newBuilder().uri(URI.create(url)).timeout(requestTimeout);
	}

	// Messages are kept free of URLs so that classification only sees the failure itself
	IOException statusError(int statusCode, HttpHeaders headers) {
		return switch (statusCode) {
			case 429 -> new FloodWaitException(
					"Too many requests - HTTP status: 429", retryAfter(headers).orElse(DEFAULT_FLOOD_WAIT));
			case 401, 403 -> new IOException("Access denied - HTTP status: " + statusCode);
			case 502, 503, 504 -> new IOException("Network error - HTTP status: " + statusCode);
			default -> new IOException("Download failed - HTTP status: " + statusCode);
		};
	}

	/** Parse a Retry-After header given either in seconds or as an HTTP date */
	Optional<Duration> retryAfter(HttpHeaders headers) {
		return headers.firstValue("Retry-After").map(String::trim).flatMap(value -> {
			try {
				return Optional.of(Duration.ofSeconds(Math.max(0, Long.parseLong(value))));
			} catch (NumberFormatException e) {
				try {
					Instant until = Instant.from(DateTimeFormatter.RFC_1123_DATE_TIME.parse(value));
					Duration wait = Duration.between(clock.instant(), until);
					return Optional.of(wait.isNegative() ? Duration.ZERO : wait);
				} catch (DateTimeParseException ex) {
					logger.debug("Ignoring malformed Retry-After header '{}'", value);
					return Optional.empty();
				}
			}
		});
	}

	private static boolean isSuccess(int statusCode) {
		return statusCode >= 200 && statusCode < 300;
	}
}
