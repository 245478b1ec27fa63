package com.peerroom.negotiation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.peerroom.config.PeerRoomProperties;
import com.peerroom.dto.SignalPayloadCodec;
import com.peerroom.media.LocalMedia;
import com.peerroom.model.PeerIdentity;
import com.peerroom.model.RoomIdentity;
import com.peerroom.relay.RelayChannelFactory;
import com.peerroom.relay.SignalingRelayClient;
import com.peerroom.transport.SessionTransportFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Entry point for joining a room. Each call gets its own identity, relay client and coordinator;
 * nothing is shared between rooms.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RoomSessionFactory {

	private final PeerRoomProperties properties;
	private final RelayChannelFactory relayChannelFactory;
	private final ObjectMapper objectMapper;

	/**
	 * Build and start a session for the room. The returned coordinator is already joining;
	 * watch the observer for the outcome, or {@link SessionCoordinator#start()} again after a relay failure.
	 */
	public SessionCoordinator open(String roomId, SessionTransportFactory transportFactory, LocalMedia localMedia,
			SessionObserver observer) {
		RoomIdentity room = RoomIdentity.of(roomId);
		PeerIdentity self = PeerIdentity.random();
		log.info("Opening session for room {} with identity {}", room, self);

		SignalingRelayClient relay = new SignalingRelayClient(relayChannelFactory, self,
				properties.getSubscribeTimeout(), properties.getDisconnectGrace());

		SessionCoordinator coordinator = SessionCoordinator.builder()
				.room(room)
				.relay(relay)
				.transportFactory(transportFactory)
				.transportConfiguration(properties.toTransportConfiguration())
				.localMedia(localMedia)
				.observer(observer)
				.settings(properties.toNegotiationSettings())
				.codec(new SignalPayloadCodec(objectMapper))
				.build();
		coordinator.start();
		return coordinator;
	}
}
