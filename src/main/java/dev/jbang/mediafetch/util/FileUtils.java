package dev.jbang.mediafetch.util;

import dev.jbang.mediafetch.fetch.HttpMediaFetcher;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/** Utility class for file operations */
public class FileUtils {
	private static final Pattern ILLEGAL_CHARACTERS = Pattern.compile("[<>:\"/\\\\|?*\\x00-\\x1F]");
	private static final int MAX_FILENAME_LENGTH = 100;

	/** Ensure a directory exists, creating it if necessary */
	public static void ensureDirectory(Path directory) throws IOException {
		if (!Files.exists(directory)) {
			Files.createDirectories(directory);
		}
	}

	/**
	 * Replace characters that are not allowed in file names and cap the length. Names that would
	 * refer to a directory ({@code .} and {@code ..}) become {@code _}.
	 */
	public static String sanitizeFilename(String name) {
		String sanitized = ILLEGAL_CHARACTERS.matcher(name).replaceAll("_");
		if (sanitized.length() > MAX_FILENAME_LENGTH) {
			sanitized = sanitized.substring(0, MAX_FILENAME_LENGTH);
		}
		if (sanitized.equals(".") || sanitized.equals("..")) {
			return "_";
		}
		return sanitized;
	}

	/** Whether a file is an unfinished download left behind by the HTTP fetcher */
	public static boolean isPartialFile(Path file) {
		return file.getFileName().toString().endsWith(HttpMediaFetcher.PART_SUFFIX);
	}

	/** Whether a file exists but holds no data */
	public static boolean isEmptyFile(Path file) throws IOException {
		return Files.isRegularFile(file) && Files.size(file) == 0;
	}
}
