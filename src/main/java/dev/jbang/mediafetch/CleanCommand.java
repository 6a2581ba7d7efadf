package dev.jbang.mediafetch;

import dev.jbang.mediafetch.util.FileUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Clean command to remove leftovers of interrupted or failed downloads */
@Command(
		name = "clean",
		description = "Clean up the output directory by removing empty and partially downloaded files",
		mixinStandardHelpOptions = true)
public class CleanCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"-o", "--output-dir"},
			description = "Directory containing downloaded files (default: media)",
			defaultValue = "media")
	private Path outputDir;

	@Option(
			names = {"--remove-empty"},
			description = "Remove files that exist but hold no data")
	private boolean removeEmpty;

	@Option(
			names = {"--remove-partial"},
			description = "Remove unfinished download files (*.part)")
	private boolean removePartial;

	@Option(
			names = {"--dry-run"},
			description = "Show statistics without actually deleting files")
	private boolean dryRun;

	@Override
	public Integer call() throws Exception {
		logger.info("Media Fetch - Clean");
		logger.info("===================");
		logger.info("Output directory: {}", outputDir.toAbsolutePath());

		// Apply default values if no options specified
		if (!removeEmpty && !removePartial && !dryRun) {
			logger.info("No options specified, using defaults: --remove-empty --remove-partial --dry-run");
			logger.info("");
			removeEmpty = true;
			removePartial = true;
			dryRun = true;
		}

		logger.info("Configuration:");
		logger.info("  Remove empty: {}", removeEmpty);
		logger.info("  Remove partial: {}", removePartial);
		logger.info("  Dry run: {}", dryRun);
		logger.info("");

		if (!Files.isDirectory(outputDir)) {
			logger.error("Error: Output directory not found: {}", outputDir.toAbsolutePath());
			return 1;
		}

		final CleanStats stats = new CleanStats();
		final List<Path> filesToDelete = new ArrayList<>();

		try (Stream<Path> paths = Files.walk(outputDir)) {
			for (Path file : paths.filter(Files::isRegularFile).sorted().toList()) {
				try {
					processFile(file, stats, filesToDelete);
				} catch (IOException e) {
					logger.error("Failed to process {}: {}", file.getFileName(), e.getMessage());
					stats.errors++;
				}
			}
		}

		// Print summary
		logger.info("");
		logger.info("Summary:");
		logger.info("========");
		logger.info("Total files scanned: {}", stats.totalFiles);
		logger.info("Partial files: {}", stats.partialFiles);
		logger.info("Empty files: {}", stats.emptyFiles);
		logger.info("Errors: {}", stats.errors);
		logger.info("");

		if (filesToDelete.isEmpty()) {
			logger.info("No files to delete.");
			return 0;
		}

		logger.info("Files to delete: {}", filesToDelete.size());

		if (dryRun) {
			logger.info("");
			logger.info("DRY RUN - No files were actually deleted.");
			logger.info("Run without --dry-run to perform actual deletion.");
			return 0;
		}

		logger.info("");
		logger.info("Deleting files...");
		int deletedCount = 0;
		int failedCount = 0;

		for (Path file : filesToDelete) {
			try {
				Files.delete(file);
				deletedCount++;
				logger.info("  Deleted: {}", file.getFileName());
			} catch (IOException e) {
				logger.error("  Failed to delete {}: {}", file.getFileName(), e.getMessage());
				failedCount++;
			}
		}

		logger.info("");
		logger.info("Deleted: {} files", deletedCount);
		if (failedCount > 0) {
			logger.info("Failed: {} files", failedCount);
			return 1;
		}
		return 0;
	}

	private void processFile(Path file, CleanStats stats, List<Path> filesToDelete) throws IOException {
		stats.totalFiles++;

		String reason = null;
		if (removePartial && FileUtils.isPartialFile(file)) {
			stats.partialFiles++;
			reason = "partial download";
		} else if (removeEmpty && FileUtils.isEmptyFile(file)) {
			stats.emptyFiles++;
			reason = "empty";
		}

		if (reason != null) {
			filesToDelete.add(file);
			logger.debug("  - {} ({})", file.getFileName(), reason);
		}
	}

	/** Statistics for clean operation */
	private static class CleanStats {
		int totalFiles = 0;
		int partialFiles = 0;
		int emptyFiles = 0;
		int errors = 0;
	}
}
