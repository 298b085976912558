package com.github.micycle1.surfrec.concurrent;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

/**
 * Bounded pool of worker threads with an ordered fan-out/join: one task per
 * index, results returned in index order regardless of completion order.
 */
public class WorkerPool implements AutoCloseable {

	private final ExecutorService threadPool;
	private final int numThreads;

	public WorkerPool(int numThreads) {
		this(Executors.newFixedThreadPool(requirePositive(numThreads), daemonThreads()), numThreads);
	}

	private WorkerPool(ExecutorService threadPool, int numThreads) {
		this.threadPool = threadPool;
		this.numThreads = requirePositive(numThreads);
	}

	@Override
	public void close() {
		threadPool.shutdown();
	}

	public int getNumThreads() {
		return numThreads;
	}

	/**
	 * Runs {@code task} for every index in {@code [from, to)} and waits for all
	 * of them. A task failure is rethrown as-is when unchecked, otherwise wrapped
	 * in an {@link IllegalStateException}; remaining tasks are cancelled.
	 */
	public <T> List<T> mapOrdered(IntFunction<T> task, int from, int to) throws InterruptedException {
		List<Future<T>> futures = new ArrayList<>(Math.max(0, to - from));
		for (int i = from; i < to; i++) {
			final int index = i;
			futures.add(threadPool.submit(() -> task.apply(index)));
		}

		List<T> results = new ArrayList<>(futures.size());
		try {
			for (Future<T> future : futures) {
				results.add(future.get());
			}
		} catch (ExecutionException e) {
			futures.forEach(f -> f.cancel(true));
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			if (cause instanceof Error) {
				throw (Error) cause;
			}
			throw new IllegalStateException("Worker task failed", cause);
		} catch (InterruptedException e) {
			futures.forEach(f -> f.cancel(true));
			throw e;
		}
		return results;
	}

	private static int requirePositive(int numThreads) {
		if (numThreads < 1) {
			throw new IllegalArgumentException("Worker pool needs at least one thread, got " + numThreads);
		}
		return numThreads;
	}

	private static ThreadFactory daemonThreads() {
		AtomicInteger count = new AtomicInteger();
		return r -> {
			Thread t = new Thread(r, "surfrec-worker-" + count.incrementAndGet());
			t.setDaemon(true);
			return t;
		};
	}
}
