package dev.jbang.mediafetch.governor;

import dev.jbang.mediafetch.fetch.FloodWaitException;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a raised fetch failure onto an {@link ErrorKind}. Classification never throws: anything
 * not recognized is {@link ErrorKind#UNKNOWN}.
 */
public class ErrorClassifier {
	private static final Logger logger = LoggerFactory.getLogger(ErrorClassifier.class);

	private static final List<String> NETWORK_MARKERS = List.of("connection", "network");
	private static final List<String> PERMISSION_MARKERS = List.of("permission", "access");
	// Guards against cyclic cause chains
	private static final int MAX_CAUSE_DEPTH = 16;

	public Classification classify(Throwable error) {
		if (error == null) {
			return Classification.UNKNOWN;
		}
		try {
			Throwable current = error;
			for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
				if (current instanceof FloodWaitException floodWait) {
					return Classification.floodWait(floodWait.getWaitSeconds());
				}
				current = current.getCause();
			}

			String message = error.getMessage();
			if (message != null) {
				String lower = message.toLowerCase(Locale.ROOT);
				if (containsAny(lower, NETWORK_MARKERS)) {
					return Classification.NETWORK;
				}
				if (containsAny(lower, PERMISSION_MARKERS)) {
					return Classification.PERMISSION;
				}
			}
		} catch (RuntimeException e) {
			logger.debug("Failed to inspect {}, treating it as unknown", error.getClass().getName(), e);
		}
		return Classification.UNKNOWN;
	}

	private static boolean containsAny(String message, List<String> markers) {
		for (String marker : markers) {
			if (message.contains(marker)) {
				return true;
			}
		}
		return false;
	}
}
