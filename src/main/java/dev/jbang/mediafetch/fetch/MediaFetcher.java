package dev.jbang.mediafetch.fetch;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Fetch primitive provided by the protocol client. Implementations must only return once the
 * destination file has been fully written and closed.
 */
@FunctionalInterface
public interface MediaFetcher {
	/**
	 * Fetch a remote attachment into a local file.
	 *
	 * @param mediaRef Opaque reference to the remote attachment
	 * @param destination The file to write
	 * @return Number of bytes written
	 * @throws FloodWaitException if the remote endpoint demands a cool-down
	 * @throws IOException if the fetch failed for any other reason
	 * @throws InterruptedException if the calling thread was interrupted
	 */
	long fetch(String mediaRef, Path destination) throws IOException, InterruptedException;
}
