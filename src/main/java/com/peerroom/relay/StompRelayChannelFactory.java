package com.peerroom.relay;

import com.peerroom.dto.SignalMessage;
import com.peerroom.model.PeerIdentity;
import com.peerroom.model.RoomIdentity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompFrameHandler;
import org.springframework.messaging.simp.stomp.StompHeaders;
import org.springframework.messaging.simp.stomp.StompSession;
import org.springframework.messaging.simp.stomp.StompSessionHandlerAdapter;
import org.springframework.web.socket.messaging.WebSocketStompClient;

import java.lang.reflect.Type;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Relay channels backed by the STOMP relay service: one STOMP session per room membership,
 * subscribed to {@code /topic/room/{roomId}} and publishing to {@code /app/room/{roomId}/signal}.
 * A channel counts as subscribed once the relay has sent the RECEIPT for its SUBSCRIBE frame.
 */
@Slf4j
@RequiredArgsConstructor
public class StompRelayChannelFactory implements RelayChannelFactory {

	private final WebSocketStompClient stompClient;
	private final String relayUrl;

	@Override
	public RelayChannel open(RoomIdentity room, PeerIdentity self) {
		return new StompRelayChannel(room, self);
	}

	static String topicFor(RoomIdentity room) {
		return "/topic/room/" + room.getValue();
	}

	static String destinationFor(RoomIdentity room) {
		return "/app/room/" + room.getValue() + "/signal";
	}

	private final class StompRelayChannel extends StompSessionHandlerAdapter implements RelayChannel {

		private final RoomIdentity room;
		private final PeerIdentity self;
		private volatile StompSession session;
		private volatile boolean closed;

		private StompRelayChannel(RoomIdentity room, PeerIdentity self) {
			this.room = room;
			this.self = self;
		}

		@Override
		public CompletableFuture<Void> subscribe(Consumer<SignalMessage> listener) {
			return stompClient.connectAsync(relayUrl, this).thenCompose(connected -> {
				session = connected;
				if (closed) {
					connected.disconnect();
					throw new IllegalStateException("Channel closed while connecting");
				}
				String topic = topicFor(room);
				StompHeaders headers = new StompHeaders();
				headers.setDestination(topic);
				headers.setReceipt("subscribe-" + self.getValue());
				StompSession.Subscription subscription = connected.subscribe(headers, new StompFrameHandler() {
					@Override
					public Type getPayloadType(StompHeaders headers) {
						return SignalMessage.class;
					}

					@Override
					public void handleFrame(StompHeaders headers, Object payload) {
						SignalMessage message = (SignalMessage) payload;
						if (message == null || self.getValue().equals(message.getSenderId())) {
							return;
						}
						listener.accept(message);
					}
				});

				// Only a receipt proves the broker will route the room's messages to us
				CompletableFuture<Void> acknowledged = new CompletableFuture<>();
				subscription.addReceiptTask(() -> {
					log.debug("STOMP session {} subscribed to {}", connected.getSessionId(), topic);
					acknowledged.complete(null);
				});
				subscription.addReceiptLostTask(() -> acknowledged.completeExceptionally(
						new IllegalStateException("No receipt for subscription to " + topic)));
				return acknowledged;
			});
		}

		@Override
		public CompletableFuture<Void> publish(SignalMessage message) {
			StompSession current = session;
			if (current == null || !current.isConnected()) {
				return CompletableFuture.failedFuture(new IllegalStateException("STOMP session not connected"));
			}
			try {
				current.send(destinationFor(room), message);
				return CompletableFuture.completedFuture(null);
			} catch (MessageDeliveryException e) {
				return CompletableFuture.failedFuture(e);
			}
		}

		@Override
		public CompletableFuture<Void> close() {
			closed = true;
			StompSession current = session;
			if (current != null && current.isConnected()) {
				current.disconnect();
				log.debug("STOMP session {} for room {} disconnected", current.getSessionId(), room);
			}
			return CompletableFuture.completedFuture(null);
		}

		@Override
		public void handleException(StompSession stompSession, StompCommand command, StompHeaders headers,
				byte[] payload, Throwable exception) {
			log.error("STOMP frame handling error in room {} (command={}): {}", room, command,
					exception.getMessage(), exception);
		}

		@Override
		public void handleTransportError(StompSession stompSession, Throwable exception) {
			if (!closed) {
				log.warn("STOMP transport error in room {}: {}", room, exception.getMessage());
			}
		}
	}
}
