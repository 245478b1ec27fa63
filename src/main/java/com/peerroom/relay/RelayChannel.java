package com.peerroom.relay;

import com.peerroom.dto.SignalMessage;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Opaque publish/subscribe channel for one room, opened for one local identity.
 * No ordering and no redelivery: only a subscriber that is listening when a message is published receives it,
 * and a sender never receives its own messages.
 */
public interface RelayChannel {

	/**
	 * Start listening. The returned future completes once the relay acknowledged the subscription.
	 */
	CompletableFuture<Void> subscribe(Consumer<SignalMessage> listener);

	CompletableFuture<Void> publish(SignalMessage message);

	CompletableFuture<Void> close();
}
