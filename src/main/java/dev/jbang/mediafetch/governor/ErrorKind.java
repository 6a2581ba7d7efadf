package dev.jbang.mediafetch.governor;

/** Classified kinds of fetch failures */
public enum ErrorKind {
	/** Remote-imposed cool-down, recoverable after waiting */
	FLOOD_WAIT,
	/** Transient transport problem, recoverable with jittered backoff */
	NETWORK,
	/** Not allowed to fetch this attachment, never retried */
	PERMISSION,
	/** Anything else, retried up to the attempt cap */
	UNKNOWN
}
