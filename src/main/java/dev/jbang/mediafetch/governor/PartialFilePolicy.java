package dev.jbang.mediafetch.governor;

/** What to do with the destination file of a task that was cancelled or failed for good */
public enum PartialFilePolicy {
	/** Remove the file so that no invalid data is left behind */
	DELETE,
	/** Leave the file for a later re-check against the remote size */
	KEEP
}
