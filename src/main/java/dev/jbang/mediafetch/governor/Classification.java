package dev.jbang.mediafetch.governor;

/**
 * Verdict of the {@link ErrorClassifier}. The wait is only meaningful for {@link
 * ErrorKind#FLOOD_WAIT}.
 */
public record Classification(ErrorKind kind, double waitSeconds) {
	public static final Classification NETWORK = new Classification(ErrorKind.NETWORK, 0);
	public static final Classification PERMISSION = new Classification(ErrorKind.PERMISSION, 0);
	public static final Classification UNKNOWN = new Classification(ErrorKind.UNKNOWN, 0);

	public static Classification floodWait(double waitSeconds) {
		return new Classification(ErrorKind.FLOOD_WAIT, waitSeconds);
	}

	public boolean isFloodWait() {
		return kind == ErrorKind.FLOOD_WAIT;
	}

	@Override
	public String toString() {
		return isFloodWait() ? "FLOOD_WAIT(" + waitSeconds + "s)" : kind.toString();
	}
}
