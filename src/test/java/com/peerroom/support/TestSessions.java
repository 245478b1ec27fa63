package com.peerroom.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.peerroom.dto.SignalKind;
import com.peerroom.dto.SignalMessage;
import com.peerroom.dto.SignalPayloadCodec;
import com.peerroom.media.LocalMedia;
import com.peerroom.model.PeerIdentity;
import com.peerroom.model.RoomIdentity;
import com.peerroom.negotiation.NegotiationSettings;
import com.peerroom.negotiation.SessionCoordinator;
import com.peerroom.relay.RelayChannelFactory;
import com.peerroom.relay.SignalingRelayClient;

import java.time.Duration;

/**
 * Coordinators wired with short timings for tests.
 */
public final class TestSessions {

	public static final ObjectMapper MAPPER = new ObjectMapper();
	public static final SignalPayloadCodec CODEC = new SignalPayloadCodec(MAPPER);

	public static final NegotiationSettings FAST = NegotiationSettings.builder()
			.presenceInterval(Duration.ofMillis(100))
			.presenceRetries(5)
			.mediaWaitTimeout(Duration.ofMillis(200))
			.leaveGrace(Duration.ofMillis(300))
			.transportTimeout(Duration.ofMillis(300))
			.build();

	private TestSessions() {
	}

	public static SignalingRelayClient relay(RelayChannelFactory channels, String self) {
		return new SignalingRelayClient(channels, PeerIdentity.of(self), Duration.ofMillis(500), Duration.ofMillis(100));
	}

	public static SessionCoordinator coordinator(RelayChannelFactory channels, FakeTransportFactory transports,
			String self, String room, LocalMedia media, RecordingObserver observer) {
		return coordinator(channels, transports, self, room, media, observer, FAST);
	}

	public static SessionCoordinator coordinator(RelayChannelFactory channels, FakeTransportFactory transports,
			String self, String room, LocalMedia media, RecordingObserver observer, NegotiationSettings settings) {
		return SessionCoordinator.builder()
				.room(RoomIdentity.of(room))
				.relay(relay(channels, self))
				.transportFactory(transports)
				.localMedia(media)
				.observer(observer)
				.settings(settings)
				.codec(CODEC)
				.build();
	}

	/**
	 * A message as a scripted participant would publish it
	 */
	public static SignalMessage signal(SignalKind kind, String room, String sender, Object payload) {
		JsonNode encoded = payload != null ? CODEC.encode(payload) : null;
		return SignalMessage.builder()
				.kind(kind)
				.roomId(room)
				.senderId(sender)
				.payload(encoded)
				.build();
	}
}
