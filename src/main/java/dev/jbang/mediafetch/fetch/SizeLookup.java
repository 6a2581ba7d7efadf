package dev.jbang.mediafetch.fetch;

import java.io.IOException;

/** Remote size lookup, used to fill the size cache on a miss */
@FunctionalInterface
public interface SizeLookup {
	/**
	 * @param key Opaque attachment identifier
	 * @return Size of the remote attachment in bytes, or a negative value if unknown
	 */
	long lookupSize(String key) throws IOException, InterruptedException;
}
