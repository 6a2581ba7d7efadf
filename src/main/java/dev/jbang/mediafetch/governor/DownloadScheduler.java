package dev.jbang.mediafetch.governor;

import dev.jbang.mediafetch.fetch.FloodWaitException;
import dev.jbang.mediafetch.fetch.MediaFetcher;
import dev.jbang.mediafetch.fetch.SizeLookup;
import dev.jbang.mediafetch.stats.DownloadStats;
import dev.jbang.mediafetch.stats.StatsCollector;
import dev.jbang.mediafetch.stats.StatsSession;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloads a lazily produced sequence of attachments in batches, under adaptive concurrency.
 *
 * <p>One scheduling thread (the caller of {@link #submit}) forms a batch, waits the governed delay
 * before each dispatch and hands fetches to a bounded worker pool, never keeping more than the
 * current worker count in flight. Once every task of the batch is back the outcomes are applied,
 * in completion order, to the {@link RateGovernor} and the statistics. Only then is the next batch
 * formed, so its parameters reflect everything the previous batch observed. Worker threads never
 * touch the governor.
 *
 * <p>Failures are classified and absorbed into {@link TaskOutcome}s: flood waits and network
 * problems are waited out by the failing task and retried, permission problems are final, and
 * anything else is retried until the attempt cap is reached.
 */
public class DownloadScheduler implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(DownloadScheduler.class);

	static final Duration MAX_FLOOD_WAIT = Duration.ofSeconds(300);
	static final double NETWORK_BACKOFF_MIN = 3.0;
	static final double NETWORK_BACKOFF_MAX = 8.0;

	private final GovernorConfig config;
	private final MediaFetcher fetcher;
	private final SizeLookup sizeLookup;
	private final RateGovernor governor;
	private final ErrorClassifier classifier;
	private final SizeCache sizeCache;
	private final StatsCollector stats;
	private final Sleeper sleeper;
	private final Random random;
	private final PartialFilePolicy partialFilePolicy;
	private final ExecutorService executor;
	private final Set<Future<TaskOutcome>> inFlight = ConcurrentHashMap.newKeySet();

	private volatile boolean cancelled;
	private volatile int pendingTasks;

	private DownloadScheduler(Builder builder) {
		this.config = builder.config;
		this.fetcher = builder.fetcher;
		this.sizeLookup = builder.sizeLookup;
		this.random = builder.random != null ? builder.random : new Random();
		this.governor = new RateGovernor(config, builder.clock, random);
		this.classifier = new ErrorClassifier();
		this.sizeCache = new SizeCache(config.cacheTtl(), config.cacheCapacity(), builder.clock);
		this.stats = new StatsCollector(builder.clock);
		this.sleeper = builder.sleeper;
		this.partialFilePolicy = builder.partialFilePolicy;
		this.executor = Executors.newFixedThreadPool(config.maxWorkers(), new WorkerThreadFactory());
	}

	public static Builder builder(MediaFetcher fetcher) {
		return new Builder(fetcher);
	}

	/**
	 * Download every task of a sequence. Blocks until the sequence is exhausted and every task
	 * reached a terminal status.
	 *
	 * @param tasks The tasks, pulled lazily one batch at a time
	 * @param listener Receives terminal outcomes and per-batch statistics
	 * @return Summary of this submission
	 * @throws CancellationException if {@link #cancel()} was called
	 * @throws InterruptedException if the calling thread was interrupted
	 */
	public DownloadReport submit(Iterator<DownloadTask> tasks, DownloadListener listener)
			throws InterruptedException {
		Objects.requireNonNull(listener, "listener");
		Batcher batcher = new Batcher(tasks);
		DownloadReport.Builder report = new DownloadReport.Builder();

		try (StatsSession session = stats.openSession()) {
			int batchNumber = 0;
			while (batcher.hasNext()) {
				checkCancelled();
				int workers = governor.currentWorkers();
				List<DownloadTask> batch = batcher.nextBatch(workers);
				pendingTasks = batcher.pendingCount();
				batchNumber++;
				logger.debug("Starting batch {} with {} tasks and {} workers", batchNumber, batch.size(), workers);

				for (Completed completed : runBatch(batch, workers)) {
					applyOutcome(completed, batcher, session, report, listener);
				}
				pendingTasks = batcher.pendingCount();

				DownloadStats current = getStats();
				logger.info(
						"Downloads: {} pending, {} completed, {} failed, {} flood waits",
						current.pendingTasks(),
						current.successfulDownloads(),
						current.failedDownloads(),
						current.floodWaits());
				listener.onBatchCompleted(batchNumber, current);
			}
			checkCancelled();
		} finally {
			pendingTasks = 0;
		}

		DownloadReport result = report.build();
		logger.info("Finished: {}", result);
		return result;
	}

	public DownloadReport submit(Iterable<DownloadTask> tasks, DownloadListener listener)
			throws InterruptedException {
		return submit(tasks.iterator(), listener);
	}

	public DownloadReport submit(Iterable<DownloadTask> tasks) throws InterruptedException {
		return submit(tasks.iterator(), DownloadListener.NONE);
	}

	/**
	 * Stop downloading. No further batches or dispatches are started and fetches in flight are
	 * interrupted. The running {@link #submit} call ends with a {@link CancellationException}.
	 */
	public void cancel() {
		if (!cancelled) {
			cancelled = true;
			logger.info("Cancelling downloads, {} in flight", inFlight.size());
		}
		for (Future<TaskOutcome> future : inFlight) {
			future.cancel(true);
		}
	}

	public boolean isCancelled() {
		return cancelled;
	}

	public DownloadStats getStats() {
		return stats.snapshot(governor.snapshot(), pendingTasks);
	}

	public GovernorSnapshot governorState() {
		return governor.snapshot();
	}

	@Override
	public void close() {
		executor.shutdownNow();
		try {
			if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
				logger.warn("Download workers did not terminate in time");
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}

	/** Run one batch to completion and return its outcomes in completion order */
	List<Completed> runBatch(List<DownloadTask> batch, int workers) throws InterruptedException {
		CompletionService<TaskOutcome> completion = new ExecutorCompletionService<>(executor);
		Map<Future<TaskOutcome>, DownloadTask> dispatched = new HashMap<>();
		List<Completed> outcomes = new ArrayList<>(batch.size());

		try {
			for (DownloadTask task : batch) {
				while (dispatched.size() >= workers) {
					outcomes.add(awaitNext(completion, dispatched));
				}
				if (cancelled) {
					break;
				}
				sleeper.sleep(toDuration(governor.nextDelay()));
				if (cancelled) {
					break;
				}
				task.recordAttempt();
				Future<TaskOutcome> future = completion.submit(() -> execute(task));
				inFlight.add(future);
				dispatched.put(future, task);
				if (cancelled) {
					// cancel() may have run between the check above and the registration
					future.cancel(true);
				}
			}
			while (!dispatched.isEmpty()) {
				outcomes.add(awaitNext(completion, dispatched));
			}
		} catch (InterruptedException e) {
			cancel();
			throw e;
		}
		return outcomes;
	}

	private Completed awaitNext(
			CompletionService<TaskOutcome> completion, Map<Future<TaskOutcome>, DownloadTask> dispatched)
			throws InterruptedException {
		Future<TaskOutcome> future = completion.take();
		inFlight.remove(future);
		DownloadTask task = dispatched.remove(future);
		try {
			return new Completed(task, future.get());
		} catch (CancellationException e) {
			return new Completed(task, TaskOutcome.cancelled(task, Duration.ZERO));
		} catch (ExecutionException e) {
			Throwable cause = e.getCause() != null ? e.getCause() : e;
			logger.error("Unexpected failure while downloading {}", task.taskId(), cause);
			return new Completed(
					task,
					TaskOutcome.failed(
							task, TaskStatus.RETRYABLE, classifier.classify(cause), cause.toString(), Duration.ZERO));
		}
	}

	/** Completion handling, runs on the scheduling thread only */
	private void applyOutcome(
			Completed completed,
			Batcher batcher,
			StatsSession session,
			DownloadReport.Builder report,
			DownloadListener listener) {
		DownloadTask task = completed.task();
		TaskOutcome outcome = completed.outcome();

		if (outcome.status() != TaskStatus.SKIPPED && outcome.status() != TaskStatus.CANCELLED) {
			session.recordAttempt();
		}

		switch (outcome.status()) {
			case SUCCEEDED -> {
				governor.onSuccess();
				session.recordSuccess(outcome.bytesWritten());
				logger.debug("Downloaded {} ({} bytes)", task.taskId(), outcome.bytesWritten());
			}
			case SKIPPED -> {
				session.recordSkipped();
				logger.debug("Skipped {}, already complete", task.taskId());
			}
			case PERMANENT -> {
				governor.onFailure();
				session.recordFailure();
				discardPartial(task);
			}
			case RETRYABLE -> {
				if (outcome.error() != null && outcome.error().isFloodWait()) {
					session.recordFloodWait();
					governor.onThrottle(outcome.error().waitSeconds());
				} else {
					governor.onFailure();
				}
				if (task.attempts() >= config.maxRetries()) {
					logger.warn(
							"Giving up on {} after {} attempts: {}",
							task.taskId(),
							task.attempts(),
							outcome.errorMessage());
					outcome = outcome.withStatus(TaskStatus.EXHAUSTED);
					session.recordFailure();
					discardPartial(task);
				} else {
					logger.debug("Re-queueing {} after attempt {}", task.taskId(), task.attempts());
					batcher.requeue(task);
					return;
				}
			}
			case EXHAUSTED, CANCELLED -> {
				// Reported as is
			}
		}

		report.add(outcome);
		listener.onOutcome(outcome);
	}

	/** Runs on a worker thread */
	private TaskOutcome execute(DownloadTask task) {
		long start = System.nanoTime();
		Path destination = task.destination();
		FileState before = FileState.read(destination);
		try {
			long existing = completeSize(task);
			if (existing >= 0) {
				return TaskOutcome.skipped(task, existing, since(start));
			}

			Path parent = destination.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			long bytes = fetcher.fetch(task.mediaRef(), destination);
			if (!Files.isRegularFile(destination) || Files.size(destination) == 0) {
				throw new IOException("Downloaded file is empty");
			}
			return TaskOutcome.succeeded(task, bytes, since(start));
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			markIfChanged(task, before);
			discardPartial(task);
			return TaskOutcome.cancelled(task, since(start));
		} catch (Exception e) {
			markIfChanged(task, before);
			if (cancelled || Thread.currentThread().isInterrupted()) {
				discardPartial(task);
				return TaskOutcome.cancelled(task, since(start));
			}
			return backOff(task, classifier.classify(e), e, start);
		}
	}

	/**
	 * Size of the destination if it already holds the complete remote attachment, -1 if it has to
	 * be fetched. A failing lookup means fetching; only flood waits and interrupts get through.
	 */
	private long completeSize(DownloadTask task) throws FloodWaitException, InterruptedException {
		Path destination = task.destination();
		if (sizeLookup == null || !Files.isRegularFile(destination)) {
			return -1;
		}
		try {
			long expected = sizeCache.get(task.mediaRef(), sizeLookup);
			long actual = Files.size(destination);
			return expected > 0 && actual == expected ? actual : -1;
		} catch (FloodWaitException e) {
			throw e;
		} catch (IOException | RuntimeException e) {
			logger.warn("Size check for {} failed, downloading it again: {}", task.taskId(), e.getMessage());
			return -1;
		}
	}

	/** Remember that this dispatch created or modified the destination, making it ours to discard */
	private static void markIfChanged(DownloadTask task, FileState before) {
		if (!Objects.equals(before, FileState.read(task.destination()))) {
			task.markDestinationWritten();
		}
	}

	/** Wait out a failure on the failing task's own thread and decide its status */
	private TaskOutcome backOff(DownloadTask task, Classification error, Exception e, long start) {
		String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
		try {
			switch (error.kind()) {
				case FLOOD_WAIT -> {
					Duration wait = toDuration(error.waitSeconds());
					if (wait.compareTo(MAX_FLOOD_WAIT) > 0) {
						wait = MAX_FLOOD_WAIT;
					}
					logger.warn(
							"Flood wait of {}s for {} (attempt {})", wait.toSeconds(), task.taskId(), task.attempts());
					sleeper.sleep(wait);
				}
				case NETWORK -> {
					double pause =
							NETWORK_BACKOFF_MIN + random.nextDouble() * (NETWORK_BACKOFF_MAX - NETWORK_BACKOFF_MIN);
					logger.warn(
							"Network error for {} (attempt {}), pausing {}s: {}",
							task.taskId(),
							task.attempts(),
							Math.round(pause),
							message);
					sleeper.sleep(toDuration(pause));
				}
				case PERMISSION -> {
					logger.error("No permission to download {}: {}", task.taskId(), message);
					return TaskOutcome.failed(task, TaskStatus.PERMANENT, error, message, since(start));
				}
				case UNKNOWN -> logger.warn(
						"Failed to download {} (attempt {}): {}", task.taskId(), task.attempts(), message);
			}
		} catch (InterruptedException ie) {
			Thread.currentThread().interrupt();
			discardPartial(task);
			return TaskOutcome.cancelled(task, since(start));
		}
		return TaskOutcome.failed(task, TaskStatus.RETRYABLE, error, message, since(start));
	}

	/** Remove an invalid destination, but only if this scheduler wrote it */
	private void discardPartial(DownloadTask task) {
		if (partialFilePolicy != PartialFilePolicy.DELETE || !task.destinationWritten()) {
			return;
		}
		try {
			if (Files.deleteIfExists(task.destination())) {
				logger.debug("Removed incomplete file {}", task.destination());
			}
		} catch (IOException e) {
			logger.warn("Could not remove incomplete file {}: {}", task.destination(), e.getMessage());
		}
	}

	private void checkCancelled() {
		if (cancelled) {
			throw new CancellationException("Download cancelled");
		}
	}

	private static Duration since(long startNanos) {
		return Duration.ofNanos(System.nanoTime() - startNanos);
	}

	static Duration toDuration(double seconds) {
		return Duration.ofNanos(Math.round(seconds * 1_000_000_000L));
	}

	/** A task together with the outcome of its latest dispatch */
	record Completed(DownloadTask task, TaskOutcome outcome) {}

	/** Size and modification time of a file, null when there is no readable file */
	private record FileState(long size, FileTime modified) {
		static FileState read(Path file) {
			try {
				BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
				return new FileState(attributes.size(), attributes.lastModifiedTime());
			} catch (NoSuchFileException e) {
				return null;
			} catch (IOException e) {
				logger.debug("Could not read attributes of {}: {}", file, e.getMessage());
				return null;
			}
		}
	}

	private static class WorkerThreadFactory implements ThreadFactory {
		private static final AtomicInteger poolCounter = new AtomicInteger();
		private final int pool = poolCounter.incrementAndGet();
		private final AtomicInteger threadCounter = new AtomicInteger();

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, "media-fetch-" + pool + "-" + threadCounter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}
	}

	public static class Builder {
		private final MediaFetcher fetcher;
		private GovernorConfig config = GovernorConfig.defaults();
		private SizeLookup sizeLookup;
		private Clock clock = Clock.systemUTC();
		private Sleeper sleeper = Sleeper.SYSTEM;
		private Random random;
		private PartialFilePolicy partialFilePolicy = PartialFilePolicy.DELETE;

		private Builder(MediaFetcher fetcher) {
			this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
		}

		public Builder config(GovernorConfig config) {
			this.config = Objects.requireNonNull(config, "config");
			return this;
		}

		/** Enables skipping destinations that already exist with the remote size */
		public Builder sizeLookup(SizeLookup sizeLookup) {
			this.sizeLookup = sizeLookup;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = Objects.requireNonNull(clock, "clock");
			return this;
		}

		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
			return this;
		}

		public Builder random(Random random) {
			this.random = random;
			return this;
		}

		public Builder partialFilePolicy(PartialFilePolicy partialFilePolicy) {
			this.partialFilePolicy = Objects.requireNonNull(partialFilePolicy, "partialFilePolicy");
			return this;
		}

		public DownloadScheduler build() {
			return new DownloadScheduler(this);
		}
	}
}
