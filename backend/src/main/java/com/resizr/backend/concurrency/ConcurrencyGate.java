package com.resizr.backend.concurrency;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Counting admission control in front of the pipeline. At most {@code capacity} permits are out at
 * any time; further callers get a pending future that completes when a permit is handed back.
 * Waiting never blocks a thread and acquisition never times out.
 *
 * <p>Waiters are served in arrival order, but callers must not rely on it. A waiter that cancels its
 * future is skipped.
 */
@Slf4j
public class ConcurrencyGate {

	private final int capacity;
	private final Object lock = new Object();
	private final Deque<CompletableFuture<Permit>> waiters = new ArrayDeque<>();
	private int inFlight;

	public ConcurrencyGate(int capacity) {
		if (capacity < 1) {
			throw new IllegalArgumentException("capacity must be at least 1, got " + capacity);
		}
		this.capacity = capacity;
	}

	public CompletableFuture<Permit> acquire() {
		synchronized (lock) {
			if (inFlight < capacity) {
				inFlight++;
				return CompletableFuture.completedFuture(new Permit());
			}
			CompletableFuture<Permit> pending = new CompletableFuture<>();
			waiters.addLast(pending);
			log.debug("Gate full ({} in flight), {} waiting", inFlight, waiters.size());
			return pending;
		}
	}

	/**
	 * Runs {@code task} once a permit is available and returns the permit when the task's stage
	 * completes, normally or not.
	 */
	public <T> CompletableFuture<T> submit(Supplier<? extends CompletionStage<T>> task) {
		return acquire().thenCompose(permit -> {
			CompletionStage<T> stage;
			try {
				stage = task.get();
			} catch (RuntimeException | Error e) {
				permit.close();
				throw e;
			}
			return stage.whenComplete((result, error) -> permit.close());
		});
	}

	public int getCapacity() {
		return capacity;
	}

	public int getInFlight() {
		synchronized (lock) {
			return inFlight;
		}
	}

	public int getWaiting() {
		synchronized (lock) {
			return waiters.size();
		}
	}

	private void release() {
		while (true) {
			CompletableFuture<Permit> next;
			synchronized (lock) {
				next = waiters.pollFirst();
				if (next == null) {
					inFlight--;
					return;
				}
			}
			// the slot passes straight to the waiter, inFlight is unchanged
			if (next.complete(new Permit())) {
				return;
			}
		}
	}

	public final class Permit implements AutoCloseable {
		private final AtomicBoolean released = new AtomicBoolean();

		private Permit() {
		}

		@Override
		public void close() {
			if (released.compareAndSet(false, true)) {
				release();
			}
		}
	}
}
