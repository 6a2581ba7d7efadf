package dev.jbang.mediafetch.governor;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class BatcherTest {

	@Test
	void testBatchSize() {
		assertThat(Batcher.batchSize(1)).isEqualTo(5);
		assertThat(Batcher.batchSize(2)).isEqualTo(5);
		assertThat(Batcher.batchSize(3)).isEqualTo(6);
		assertThat(Batcher.batchSize(8)).isEqualTo(16);
	}

	@Test
	void testBatchesFollowQueueOrder() {
		// Given
		Deque<DownloadTask> queue = new ArrayDeque<>(tasks(10));

		// When
		List<DownloadTask> first = Batcher.nextBatch(queue, 3);
		List<DownloadTask> second = Batcher.nextBatch(queue, 3);
		List<DownloadTask> third = Batcher.nextBatch(queue, 3);

		// Then
		assertThat(ids(first)).containsExactly("t0", "t1", "t2", "t3", "t4", "t5");
		assertThat(ids(second)).containsExactly("t6", "t7", "t8", "t9");
		assertThat(third).isEmpty();
		assertThat(queue).isEmpty();
	}

	@Test
	void testSmallConcurrencyStillUsesMinimumBatch() {
		// Given
		Deque<DownloadTask> queue = new ArrayDeque<>(tasks(10));

		// When
		List<DownloadTask> batch = Batcher.nextBatch(queue, 1);

		// Then
		assertThat(batch).hasSize(5);
		assertThat(queue).hasSize(5);
	}

	@Test
	void testSourceIsPulledLazily() {
		// Given
		AtomicInteger pulled = new AtomicInteger();
		Iterator<DownloadTask> source = new Iterator<>() {
			@Override
			public boolean hasNext() {
				return true;
			}

			@Override
			public DownloadTask next() {
				int n = pulled.getAndIncrement();
				return new DownloadTask("t" + n, "ref" + n, Path.of("t" + n));
			}
		};
		Batcher batcher = new Batcher(source);

		// When
		List<DownloadTask> batch = batcher.nextBatch(2);

		// Then
		assertThat(batch).hasSize(5);
		assertThat(pulled.get()).isEqualTo(5);
		assertThat(batcher.pendingCount()).isZero();
	}

	@Test
	void testRequeuedTasksGoToTheTail() {
		// Given
		List<DownloadTask> all = tasks(7);
		Batcher batcher = new Batcher(all.iterator());
		List<DownloadTask> first = batcher.nextBatch(1);

		// When
		batcher.requeue(first.get(0));
		List<DownloadTask> second = batcher.nextBatch(1);

		// Then
		assertThat(ids(first)).containsExactly("t0", "t1", "t2", "t3", "t4");
		assertThat(ids(second)).containsExactly("t5", "t6", "t0");
		assertThat(batcher.hasNext()).isFalse();
	}

	@Test
	void testHasNextWithOnlyRequeuedTasks() {
		// Given
		Batcher batcher = new Batcher(tasks(1).iterator());
		List<DownloadTask> batch = batcher.nextBatch(4);
		assertThat(batcher.hasNext()).isFalse();

		// When
		batcher.requeue(batch.get(0));

		// Then
		assertThat(batcher.hasNext()).isTrue();
		assertThat(batcher.pendingCount()).isEqualTo(1);
	}

	private static List<DownloadTask> tasks(int count) {
		return new ArrayList<>(IntStream.range(0, count)
				.mapToObj(i -> new DownloadTask("t" + i, "ref" + i, Path.of("t" + i)))
				.toList());
	}

	private static List<String> ids(List<DownloadTask> tasks) {
		return tasks.stream().map(DownloadTask::taskId).toList();
	}
}
