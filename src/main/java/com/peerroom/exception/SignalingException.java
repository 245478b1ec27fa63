package com.peerroom.exception;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Base type of the recoverable failures raised while joining a room and negotiating a session.
 */
public abstract class SignalingException extends RuntimeException {

	protected SignalingException(String message) {
		super(message);
	}

	protected SignalingException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * Strip the wrappers CompletableFuture puts around a failure
	 */
	public static Throwable unwrap(Throwable failure) {
		Throwable current = failure;
		while ((current instanceof CompletionException || current instanceof ExecutionException)
				&& current.getCause() != null) {
			current = current.getCause();
		}
		return current;
	}
}
