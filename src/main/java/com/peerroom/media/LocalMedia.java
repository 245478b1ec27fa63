package com.peerroom.media;

import com.peerroom.exception.MediaUnavailableException;
import com.peerroom.model.Registration;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Local camera/microphone handle as published by the media collaborator.
 * Readiness is a future so negotiation can wait for it with a deadline instead of polling.
 */
@Slf4j
public class LocalMedia {

	private final CompletableFuture<MediaHandle> ready = new CompletableFuture<>();
	private final List<Listener> listeners = new CopyOnWriteArrayList<>();
	private volatile MediaHandle current;

	public static LocalMedia pending() {
		return new LocalMedia();
	}

	public static LocalMedia of(MediaHandle media) {
		LocalMedia localMedia = new LocalMedia();
		localMedia.publish(media);
		return localMedia;
	}

	/**
	 * Publish a new local handle. Bound transports rebind their tracks on every change.
	 */
	public void publish(MediaHandle media) {
		if (media == null) {
			throw new IllegalArgumentException("Media handle must not be null");
		}
		current = media;
		ready.complete(media);
		log.debug("Local media published with {} track(s)", media.getTracks().size());
		listeners.forEach(listener -> {
			try {
				listener.onMediaChanged(media);
			} catch (RuntimeException e) {
				log.warn("Local media listener failed: {}", e.getMessage(), e);
			}
		});
	}

	/**
	 * Report that acquisition failed. Waiters stop waiting; negotiation goes on without local tracks.
	 */
	public void fail(Throwable cause) {
		MediaUnavailableException failure = cause instanceof MediaUnavailableException
				? (MediaUnavailableException) cause
				: new MediaUnavailableException("Camera/Mic access denied", cause);
		ready.completeExceptionally(failure);
		log.warn("Local media unavailable: {}", failure.getMessage());
		listeners.forEach(listener -> {
			try {
				listener.onMediaUnavailable(failure);
			} catch (RuntimeException e) {
				log.warn("Local media listener failed: {}", e.getMessage(), e);
			}
		});
	}

	public Optional<MediaHandle> current() {
		return Optional.ofNullable(current);
	}

	/**
	 * Resolves with the handle as soon as it is ready, or empty once the timeout elapses or acquisition failed.
	 */
	public CompletableFuture<Optional<MediaHandle>> awaitReady(Duration timeout) {
		MediaHandle media = current;
		if (media != null) {
			return CompletableFuture.completedFuture(Optional.of(media));
		}
		return ready.copy()
				.completeOnTimeout(null, timeout.toMillis(), TimeUnit.MILLISECONDS)
				.handle((handle, ex) -> Optional.ofNullable(ex == null ? handle : null));
	}

	public Registration addListener(Listener listener) {
		listeners.add(listener);
		return () -> listeners.remove(listener);
	}

	public interface Listener {

		void onMediaChanged(MediaHandle media);

		default void onMediaUnavailable(MediaUnavailableException failure) {
		}
	}
}
