package com.peerroom.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.peerroom.dto.SignalKind;
import com.peerroom.dto.SignalMessage;
import com.peerroom.exception.RelayUnavailableException;
import com.peerroom.exception.SendFailedException;
import com.peerroom.exception.SignalingException;
import com.peerroom.model.PeerIdentity;
import com.peerroom.model.Registration;
import com.peerroom.model.RoomIdentity;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Signaling client for one room membership. Wraps a {@link RelayChannel} with connect/send/receive/disconnect
 * and reports delivery failures. It knows nothing about negotiation.
 */
@Slf4j
public class SignalingRelayClient {

	private final RelayChannelFactory channelFactory;
	@Getter
	private final PeerIdentity self;
	private final Duration subscribeTimeout;
	private final Duration disconnectGrace;

	private final List<Consumer<SignalMessage>> listeners = new CopyOnWriteArrayList<>();
	private final Object lock = new Object();

	// Guarded by lock
	private RelayChannel channel;
	private RoomIdentity room;
	private CompletableFuture<Void> subscription;
	private long epoch;

	public SignalingRelayClient(RelayChannelFactory channelFactory, PeerIdentity self,
			Duration subscribeTimeout, Duration disconnectGrace) {
		this.channelFactory = channelFactory;
		this.self = self;
		this.subscribeTimeout = subscribeTimeout;
		this.disconnectGrace = disconnectGrace;
	}

	/**
	 * Subscribe to the room channel. Completes exceptionally with {@link RelayUnavailableException}
	 * when no subscription acknowledgment arrives within the subscribe timeout.
	 */
	public CompletableFuture<Void> connect(RoomIdentity targetRoom) {
		boolean connected;
		synchronized (lock) {
			connected = channel != null;
		}
		CompletableFuture<Void> cleanup = CompletableFuture.completedFuture(null);
		if (connected) {
			log.info("Releasing existing relay channel before connecting to room {}", targetRoom);
			cleanup = releaseChannel();
		}
		return cleanup.thenCompose(ignored -> subscribe(targetRoom));
	}

	private CompletableFuture<Void> subscribe(RoomIdentity targetRoom) {
		long attempt;
		synchronized (lock) {
			attempt = epoch;
		}
		log.info("Connecting to relay for room {} as {}", targetRoom, self);

		RelayChannel opened;
		try {
			opened = channelFactory.open(targetRoom, self);
		} catch (RuntimeException e) {
			log.error("Failed to open relay channel for room {}: {}", targetRoom, e.getMessage(), e);
			return CompletableFuture.failedFuture(
					new RelayUnavailableException(targetRoom, "channel could not be opened", e));
		}

		CompletableFuture<Void> ready = opened.subscribe(this::dispatch)
				.orTimeout(subscribeTimeout.toMillis(), TimeUnit.MILLISECONDS)
				.handle((ignored, ex) -> {
					if (ex == null) {
						return null;
					}
					Throwable cause = SignalingException.unwrap(ex);
					String reason = cause instanceof TimeoutException
							? "no subscription acknowledgment within " + subscribeTimeout.toMillis() + "ms"
							: String.valueOf(cause.getMessage());
					throw new CompletionException(new RelayUnavailableException(targetRoom, reason, cause));
				});

		synchronized (lock) {
			if (attempt != epoch) {
				opened.close();
				return CompletableFuture.failedFuture(
						new RelayUnavailableException(targetRoom, "disconnected while connecting", null));
			}
			channel = opened;
			room = targetRoom;
			subscription = ready;
		}

		return ready.whenComplete((ignored, ex) -> {
			if (ex == null) {
				log.info("Subscribed to relay channel for room {}", targetRoom);
				return;
			}
			log.error("Relay subscription for room {} failed: {}", targetRoom,
					SignalingException.unwrap(ex).getMessage());
			boolean owned;
			synchronized (lock) {
				owned = channel == opened;
				if (owned) {
					channel = null;
					room = null;
					subscription = null;
				}
			}
			if (owned) {
				opened.close();
			}
		});
	}

	/**
	 * Publish a message to the room. Waits for an in-flight subscription before publishing;
	 * completes exceptionally with {@link SendFailedException} when the message could not be handed to the relay.
	 */
	public CompletableFuture<Void> send(SignalKind kind, JsonNode payload) {
		RelayChannel current;
		RoomIdentity currentRoom;
		CompletableFuture<Void> ready;
		synchronized (lock) {
			current = channel;
			currentRoom = room;
			ready = subscription;
		}
		if (current == null) {
			log.warn("Cannot send {}, not connected", kind.getWireName());
			return CompletableFuture.failedFuture(new SendFailedException(kind, "not connected"));
		}

		SignalMessage message = SignalMessage.builder()
				.kind(kind)
				.payload(payload)
				.roomId(currentRoom.getValue())
				.senderId(self.getValue())
				.build();

		return ready
				.handle((ignored, ex) -> ex)
				.thenCompose(subscribeFailure -> {
					if (subscribeFailure != null) {
						throw new CompletionException(new SendFailedException(kind, "subscription failed",
								SignalingException.unwrap(subscribeFailure)));
					}
					return current.publish(message);
				})
				.handle((ignored, ex) -> {
					if (ex == null) {
						log.debug("Sent {} to room {}", kind.getWireName(), currentRoom);
						return null;
					}
					Throwable cause = SignalingException.unwrap(ex);
					log.error("Failed to send {} to room {}: {}", kind.getWireName(), currentRoom, cause.getMessage());
					throw new CompletionException(cause instanceof SendFailedException
							? cause
							: new SendFailedException(kind, String.valueOf(cause.getMessage()), cause));
				});
	}

	/**
	 * Register a listener for messages from the other participants. Every registered listener receives every message.
	 */
	public Registration onMessage(Consumer<SignalMessage> handler) {
		listeners.add(handler);
		return () -> listeners.remove(handler);
	}

	/**
	 * Release the subscription and drop all listeners. Safe to call while a connect is still in flight:
	 * the pending subscription is given a short grace period, then the channel is closed either way.
	 */
	public CompletableFuture<Void> disconnect() {
		listeners.clear();
		return releaseChannel().thenRun(() -> log.info("Disconnected from relay"));
	}

	public boolean isConnected() {
		synchronized (lock) {
			return subscription != null && subscription.isDone() && !subscription.isCompletedExceptionally();
		}
	}

	private CompletableFuture<Void> releaseChannel() {
		RelayChannel current;
		RoomIdentity currentRoom;
		CompletableFuture<Void> pending;
		synchronized (lock) {
			epoch++;
			current = channel;
			currentRoom = room;
			pending = subscription;
			channel = null;
			room = null;
			subscription = null;
		}
		if (current == null) {
			return CompletableFuture.completedFuture(null);
		}

		CompletableFuture<Void> settled = CompletableFuture.completedFuture(null);
		if (pending != null && !pending.isDone()) {
			log.debug("Waiting for in-flight subscription before disconnecting");
			settled = pending
					.handle((ignored, ex) -> (Void) null)
					.completeOnTimeout(null, disconnectGrace.toMillis(), TimeUnit.MILLISECONDS);
		}
		CompletableFuture<Void> abandoned = pending;
		return settled
				.thenCompose(ignored -> {
					if (abandoned != null && abandoned.completeExceptionally(
							new RelayUnavailableException(currentRoom, "disconnected while connecting", null))) {
						log.debug("Abandoned in-flight subscription for room {}", currentRoom);
					}
					return current.close();
				})
				.handle((ignored, ex) -> {
					if (ex != null) {
						log.warn("Error closing relay channel: {}", SignalingException.unwrap(ex).getMessage());
					}
					return null;
				});
	}

	private void dispatch(SignalMessage message) {
		if (self.getValue().equals(message.getSenderId())) {
			log.debug("Dropping own {} echoed by relay", message.getKind());
			return;
		}
		log.debug("Received {} from {}", message.getKind(), message.getSenderId());
		for (Consumer<SignalMessage> listener : listeners) {
			try {
				listener.accept(message);
			} catch (RuntimeException e) {
				log.error("Signal listener failed for {}: {}", message, e.getMessage(), e);
			}
		}
	}
}
