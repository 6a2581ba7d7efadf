package dev.jbang.mediafetch.governor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Forms batches from a lazily produced task sequence. Batches are FIFO slices of the pending queue
 * sized from the current concurrency; the source is only pulled as far as the next batch needs.
 * Retried tasks go to the tail of the pending queue.
 */
public class Batcher {
	static final int MIN_BATCH_SIZE = 5;

	private final Iterator<DownloadTask> source;
	private final Deque<DownloadTask> pending = new ArrayDeque<>();

	public Batcher(Iterator<DownloadTask> source) {
		this.source = Objects.requireNonNull(source, "source");
	}

	/** Batch size for the given concurrency: twice the workers, but never less than five */
	public static int batchSize(int currentWorkers) {
		return Math.max(MIN_BATCH_SIZE, currentWorkers * 2);
	}

	/**
	 * Take the next batch off the front of a queue, in queue order.
	 *
	 * @param queue The pending tasks, consumed from the head
	 * @param currentWorkers Current concurrency
	 * @return The batch, empty if the queue was empty
	 */
	public static List<DownloadTask> nextBatch(Deque<DownloadTask> queue, int currentWorkers) {
		int size = batchSize(currentWorkers);
		List<DownloadTask> batch = new ArrayList<>(Math.min(size, queue.size()));
		while (batch.size() < size && !queue.isEmpty()) {
			batch.add(queue.pollFirst());
		}
		return batch;
	}

	/** Pull as many tasks from the source as the next batch needs and slice it off */
	public List<DownloadTask> nextBatch(int currentWorkers) {
		int size = batchSize(currentWorkers);
		while (pending.size() < size && source.hasNext()) {
			pending.addLast(Objects.requireNonNull(source.next(), "source produced a null task"));
		}
		return nextBatch(pending, currentWorkers);
	}

	public void requeue(DownloadTask task) {
		pending.addLast(task);
	}

	public boolean hasNext() {
		return !pending.isEmpty() || source.hasNext();
	}

	/** Number of tasks pulled from the source (or re-queued) but not yet batched */
	public int pendingCount() {
		return pending.size();
	}
}
