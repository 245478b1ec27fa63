package com.peerroom.negotiation;

import com.peerroom.exception.SignalingException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Runs asynchronous steps strictly one after another. A step that suspends on a future keeps the loop
 * until that future completes; steps submitted meanwhile wait their turn in submission order.
 *
 * A failing step is logged and never stops the loop.
 */
@Slf4j
class SignalingEventLoop {

	private final Executor executor;
	private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);
	private boolean closed;

	SignalingEventLoop(Executor executor) {
		this.executor = executor;
	}

	synchronized <T> CompletableFuture<T> submit(String name, Supplier<? extends CompletionStage<T>> step) {
		if (closed) {
			log.debug("Event loop closed, dropping step {}", name);
			return CompletableFuture.failedFuture(new IllegalStateException("Event loop closed"));
		}
		CompletableFuture<T> result = tail.thenComposeAsync(ignored -> invoke(step), executor);
		tail = result.handle((value, ex) -> {
			if (ex != null) {
				log.warn("Step {} ended with error: {}", name, SignalingException.unwrap(ex).getMessage());
			}
			return null;
		});
		return result;
	}

	/**
	 * Reject further steps. Steps already queued still run.
	 */
	synchronized void close() {
		closed = true;
	}

	synchronized boolean isClosed() {
		return closed;
	}

	private static <T> CompletionStage<T> invoke(Supplier<? extends CompletionStage<T>> step) {
		try {
			CompletionStage<T> stage = step.get();
			return stage != null ? stage : CompletableFuture.completedFuture(null);
		} catch (RuntimeException e) {
			return CompletableFuture.failedFuture(e);
		}
	}
}
