package dev.jbang.mediafetch.fetch;

import static org.assertj.core.api.Assertions.*;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import dev.jbang.mediafetch.governor.ErrorClassifier;
import dev.jbang.mediafetch.governor.ErrorKind;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HttpMediaFetcherTest {

	private static final String LOOPBACK = "127.0.0.1";
	private static final byte[] BODY = "hello attachment".getBytes(StandardCharsets.UTF_8);

	@TempDir
	Path tempDir;

	private HttpServer server;
	private String baseUrl;
	private HttpMediaFetcher fetcher;

	@BeforeEach
	void setUp() throws IOException {
		server = HttpServer.create(new InetSocketAddress(LOOPBACK, 0), 0);
		server.createContext("/file.jpg", exchange -> {
			exchange.getResponseHeaders().add("Last-Modified", "Wed, 21 Oct 2015 07:28:00 GMT");
			exchange.getResponseHeaders().add("Content-Length", String.valueOf(BODY.length));
			if ("HEAD".equals(exchange.getRequestMethod())) {
				exchange.sendResponseHeaders(200, -1);
				exchange.close();
			} else {
				respond(exchange, 200, BODY);
			}
		});
		server.createContext("/limited", exchange -> {
			exchange.getResponseHeaders().add("Retry-After", "17");
			respond(exchange, 429, new byte[0]);
		});
		server.createContext("/limited-no-header", exchange -> respond(exchange, 429, new byte[0]));
		server.createContext("/forbidden", exchange -> respond(exchange, 403, new byte[0]));
		server.createContext("/unavailable", exchange -> respond(exchange, 503, new byte[0]));
		server.createContext("/missing", exchange -> respond(exchange, 404, new byte[0]));
		server.start();
		baseUrl = "http://" + LOOPBACK + ":" + server.getAddress().getPort();

		fetcher = new HttpMediaFetcher(Duration.ofSeconds(5), Duration.ofSeconds(10));
	}

	@AfterEach
	void tearDown() {
		server.stop(0);
	}

	@Test
	void testFetchWritesFile() throws Exception {
		// Given
		Path destination = tempDir.resolve("file.jpg");

		// When
		long bytes = fetcher.fetch(baseUrl + "/file.jpg", destination);

		// Then
		assertThat(bytes).isEqualTo(BODY.length);
		assertThat(destination).hasBinaryContent(BODY);
		assertThat(HttpMediaFetcher.partFile(destination)).doesNotExist();
		assertThat(Files.getLastModifiedTime(destination).toInstant())
				.isEqualTo(Instant.parse("2015-10-21T07:28:00Z"));
	}

	@Test
	void testTooManyRequestsBecomesFloodWait() {
		// When / Then
		assertThatThrownBy(() -> fetcher.fetch(baseUrl + "/limited", tempDir.resolve("limited")))
				.isInstanceOfSatisfying(FloodWaitException.class, e -> {
					assertThat(e.getWaitDuration()).isEqualTo(Duration.ofSeconds(17));
					assertThat(e.getWaitSeconds()).isEqualTo(17.0);
				});
		assertThat(tempDir.resolve("limited")).doesNotExist();
	}

	@Test
	void testTooManyRequestsWithoutRetryAfter() {
		assertThatThrownBy(() -> fetcher.fetch(baseUrl + "/limited-no-header", tempDir.resolve("limited")))
				.isInstanceOfSatisfying(
						FloodWaitException.class,
						e -> assertThat(e.getWaitDuration()).isEqualTo(HttpMediaFetcher.DEFAULT_FLOOD_WAIT));
	}

	@Test
	void testErrorsAreClassifiable() {
		assertThat(classifyFetch("/forbidden")).isEqualTo(ErrorKind.PERMISSION);
		assertThat(classifyFetch("/unavailable")).isEqualTo(ErrorKind.NETWORK);
		assertThat(classifyFetch("/missing")).isEqualTo(ErrorKind.UNKNOWN);
		assertThat(tempDir).isEmptyDirectory();
	}

	@Test
	void testConnectionFailure() throws IOException {
		// Given
		int port;
		try (ServerSocket socket = new ServerSocket(0, 0, InetAddress.getByName(LOOPBACK))) {
			port = socket.getLocalPort();
		}
		String url = "http://" + LOOPBACK + ":" + port + "/file.jpg";

		// When
		Throwable error = catchThrowable(() -> fetcher.fetch(url, tempDir.resolve("x")));

		// Then
		assertThat(error).isInstanceOf(IOException.class);
		assertThat(new ErrorClassifier().classify(error).kind()).isEqualTo(ErrorKind.NETWORK);
	}

	@Test
	void testLookupSize() throws Exception {
		assertThat(fetcher.lookupSize(baseUrl + "/file.jpg")).isEqualTo(BODY.length);
	}

	@Test
	void testRetryAfterAsDate() {
		// Given
		Clock clock = Clock.fixed(Instant.parse("2015-10-21T07:28:00Z"), ZoneOffset.UTC);
		HttpMediaFetcher fixed = new HttpMediaFetcher(HttpClient.newHttpClient(), Duration.ofSeconds(10), clock);

		// Then
		assertThat(fixed.retryAfter(headers("Retry-After", "Wed, 21 Oct 2015 07:28:30 GMT")))
				.contains(Duration.ofSeconds(30));
		assertThat(fixed.retryAfter(headers("Retry-After", "Wed, 21 Oct 2015 07:27:00 GMT")))
				.contains(Duration.ZERO);
		assertThat(fixed.retryAfter(headers("Retry-After", "soon"))).isEmpty();
		assertThat(fixed.retryAfter(headers("X-Other", "1"))).isEmpty();
	}

	private ErrorKind classifyFetch(String path) {
		Throwable error = catchThrowable(() -> fetcher.fetch(baseUrl + path, tempDir.resolve("out")));
		assertThat(error).isInstanceOf(IOException.class);
		return new ErrorClassifier().classify(error).kind();
	}

	private static HttpHeaders headers(String name, String value) {
		return HttpHeaders.of(Map.of(name, List.of(value)), (n, v) -> true);
	}

	private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
		exchange.sendResponseHeaders(status, body.length == 0 ? -1 : body.length);
		if (body.length > 0) {
			try (OutputStream out = exchange.getResponseBody()) {
				out.write(body);
			}
		}
		exchange.close();
	}
}
