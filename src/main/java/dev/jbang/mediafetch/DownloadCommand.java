package dev.jbang.mediafetch;

import com.fasterxml.jackson.databind.MappingIterator;
import dev.jbang.mediafetch.fetch.HttpMediaFetcher;
import dev.jbang.mediafetch.fetch.MediaFetcher;
import dev.jbang.mediafetch.fetch.SizeLookup;
import dev.jbang.mediafetch.governor.DownloadListener;
import dev.jbang.mediafetch.governor.DownloadReport;
import dev.jbang.mediafetch.governor.DownloadScheduler;
import dev.jbang.mediafetch.governor.DownloadTask;
import dev.jbang.mediafetch.governor.GovernorConfig;
import dev.jbang.mediafetch.governor.PartialFilePolicy;
import dev.jbang.mediafetch.governor.TaskOutcome;
import dev.jbang.mediafetch.model.DownloadReportFile;
import dev.jbang.mediafetch.model.ManifestEntry;
import dev.jbang.mediafetch.model.OutcomeRecord;
import dev.jbang.mediafetch.stats.DownloadStats;
import dev.jbang.mediafetch.util.FileUtils;
import dev.jbang.mediafetch.util.ManifestUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Download command to fetch every attachment listed in a manifest */
@Command(
		name = "download",
		description = "Download the attachments listed in a JSON manifest with adaptive concurrency",
		mixinStandardHelpOptions = true)
public class DownloadCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"-m", "--manifest"},
			description = "JSON file with an array of {id, url, filename} entries",
			required = true)
	private Path manifest;

	@Option(
			names = {"-o", "--output-dir"},
			description = "Directory to store downloaded files (default: media)",
			defaultValue = "media")
	private Path outputDir;

	@Option(
			names = {"-t", "--max-workers"},
			description = "Upper limit for concurrent downloads, 1-32 (default: 8)",
			defaultValue = "8")
	private int maxWorkers;

	@Option(
			names = {"--initial-workers"},
			description = "Concurrent downloads at start, 1-16 (default: 4)",
			defaultValue = "4")
	private int initialWorkers;

	@Option(
			names = {"--min-delay"},
			description = "Lower bound in seconds for the delay between dispatches (default: 0.1)",
			defaultValue = "0.1")
	private double minDelay;

	@Option(
			names = {"--max-delay"},
			description = "Upper bound in seconds for the delay between dispatches (default: 3.0)",
			defaultValue = "3.0")
	private double maxDelay;

	@Option(
			names = {"--initial-delay"},
			description = "Delay in seconds between dispatches at start (default: 0.5, within the delay bounds)")
	private Double initialDelay;

	@Option(
			names = {"--max-retries"},
			description = "Maximum number of attempts per file (default: 3)",
			defaultValue = "3")
	private int maxRetries;

	@Option(
			names = {"--cache-ttl"},
			description = "Seconds a looked up remote size stays valid (default: 300)",
			defaultValue = "300")
	private long cacheTtlSeconds;

	@Option(
			names = {"--cache-capacity"},
			description = "Maximum number of cached remote sizes (default: 100)",
			defaultValue = "100")
	private int cacheCapacity;

	@Option(
			names = {"--skip-existing"},
			description = "Skip files that already exist locally with the size reported by the server")
	private boolean skipExisting;

	@Option(
			names = {"--keep-partial"},
			description = "Keep incomplete files of failed or cancelled downloads")
	private boolean keepPartial;

	@Option(
			names = {"-r", "--report"},
			description = "Write a JSON report of all outcomes to this file")
	private Path reportFile;

	@Override
	public Integer call() throws Exception {
		logger.info("Media Fetch - Download");
		logger.info("======================");
		logger.info("Manifest: {}", manifest.toAbsolutePath());
		logger.info("Output directory: {}", outputDir.toAbsolutePath());
		logger.info("");

		if (!Files.isRegularFile(manifest)) {
			logger.error("Error: Manifest not found: {}", manifest.toAbsolutePath());
			return 1;
		}

		GovernorConfig config;
		try {
			GovernorConfig.Builder builder = GovernorConfig.builder()
					.maxWorkers(maxWorkers)
					.initialWorkers(initialWorkers)
					.minDelay(minDelay)
					.maxDelay(maxDelay)
					.maxRetries(maxRetries)
					.cacheTtl(Duration.ofSeconds(cacheTtlSeconds))
					.cacheCapacity(cacheCapacity);
			if (initialDelay != null) {
				builder.initialDelay(initialDelay);
			}
			config = builder.build();
		} catch (IllegalArgumentException e) {
			logger.error("Error: Invalid configuration: {}", e.getMessage());
			return 1;
		}
		logger.info("Configuration: {}", config);
		logger.info("");

		FileUtils.ensureDirectory(outputDir);
		HttpMediaFetcher fetcher = new HttpMediaFetcher();
		return download(fetcher, skipExisting ? fetcher : null, config);
	}

	int download(MediaFetcher fetcher, SizeLookup sizeLookup, GovernorConfig config)
			throws IOException {
		List<OutcomeRecord> outcomes = new ArrayList<>();
		DownloadListener listener = new DownloadListener() {
			@Override
			public void onOutcome(TaskOutcome outcome) {
				outcomes.add(OutcomeRecord.of(outcome));
				if (outcome.isFailure()) {
					logger.warn("  Failed: {}", outcome);
				}
			}

			@Override
			public void onBatchCompleted(int batchNumber, DownloadStats stats) {
				logger.info("Batch {}: {}", batchNumber, stats);
			}
		};

		DownloadReport report = null;
		DownloadStats stats;
		try (MappingIterator<ManifestEntry> entries = ManifestUtils.readManifest(manifest);
				DownloadScheduler scheduler = DownloadScheduler.builder(fetcher)
						.config(config)
						.sizeLookup(sizeLookup)
						.partialFilePolicy(keepPartial ? PartialFilePolicy.KEEP : PartialFilePolicy.DELETE)
						.build()) {
			Thread shutdownHook = new Thread(scheduler::cancel, "media-fetch-shutdown");
			Runtime.getRuntime().addShutdownHook(shutdownHook);
			try {
				report = scheduler.submit(new TaskIterator(entries, outputDir), listener);
			} catch (CancellationException e) {
				logger.warn("Downloads cancelled");
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.error("Interrupted while downloading");
			} finally {
				try {
					Runtime.getRuntime().removeShutdownHook(shutdownHook);
				} catch (IllegalStateException e) {
					logger.debug("Shutdown in progress, hook stays registered");
				}
			}
			stats = scheduler.getStats();
		}

		logger.info("");
		logger.info("Summary");
		logger.info("=======");
		logger.info("{}", stats);
		if (report != null) {
			logger.info("Total files: {}", report.total());
			logger.info("  Downloaded: {}", report.succeeded());
			logger.info("  Skipped: {}", report.skipped());
			logger.info("  Failed permanently: {}", report.permanent());
			logger.info("  Retries exhausted: {}", report.exhausted());
		}

		if (reportFile != null) {
			String summary = report != null ? report.toString() : "cancelled";
			ManifestUtils.saveReport(reportFile, new DownloadReportFile(summary, stats, outcomes));
			logger.info("Report written to {}", reportFile.toAbsolutePath());
		}

		if (report == null) {
			return 1;
		}
		return report.failed() > 0 ? 1 : 0;
	}

	/**
	 * Turns manifest entries into tasks as the scheduler asks for them. Entries that are unusable,
	 * repeat an id or would write to an already used file are skipped.
	 */
	private static class TaskIterator implements Iterator<DownloadTask> {
		private final Iterator<ManifestEntry> entries;
		private final Path outputDir;
		private final Set<String> seenIds = new HashSet<>();
		private final Set<Path> seenDestinations = new HashSet<>();
		private DownloadTask next;

		TaskIterator(Iterator<ManifestEntry> entries, Path outputDir) {
			this.entries = entries;
			this.outputDir = outputDir;
		}

		@Override
		public boolean hasNext() {
			while (next == null && entries.hasNext()) {
				ManifestEntry entry = entries.next();
				if (!ManifestUtils.isValidEntry(entry)) {
					logger.warn("Ignoring manifest entry without id or url: {}", entry);
				} else if (!seenIds.add(entry.id())) {
					logger.warn("Ignoring duplicate manifest entry {}", entry.id());
				} else {
					DownloadTask task = ManifestUtils.toTask(entry, outputDir);
					if (seenDestinations.add(task.destination().toAbsolutePath().normalize())) {
						next = task;
					} else {
						logger.warn(
								"Ignoring manifest entry {}, its file {} is already used by another entry",
								entry.id(),
								task.destination().getFileName());
					}
				}
			}
			return next != null;
		}

		@Override
		public DownloadTask next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			DownloadTask task = next;
			next = null;
			return task;
		}
	}
}
