package com.peerroom;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.peerroom.dto.RoomStatusResponse;
import com.peerroom.dto.SignalKind;
import com.peerroom.dto.SignalMessage;
import com.peerroom.dto.SignalPayloadCodec;
import com.peerroom.media.LocalMedia;
import com.peerroom.model.PeerIdentity;
import com.peerroom.model.RoomIdentity;
import com.peerroom.negotiation.NegotiationSettings;
import com.peerroom.negotiation.SessionCoordinator;
import com.peerroom.negotiation.SessionState;
import com.peerroom.relay.RelayChannelFactory;
import com.peerroom.relay.SignalingRelayClient;
import com.peerroom.relay.StompRelayChannelFactory;
import com.peerroom.support.FakeMediaHandle;
import com.peerroom.support.FakeTransportFactory;
import com.peerroom.support.RecordingObserver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.socket.messaging.WebSocketStompClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Coordinators talking through the real STOMP relay of a running server.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class SignalRelayIntegrationTest {

	private static final Duration WAIT = Duration.ofSeconds(10);
	private static final NegotiationSettings SETTINGS = NegotiationSettings.builder()
			.presenceInterval(Duration.ofMillis(300))
			.presenceRetries(10)
			.mediaWaitTimeout(Duration.ofMillis(500))
			.leaveGrace(Duration.ofMillis(500))
			.build();

	@LocalServerPort
	private int port;

	@Autowired
	private WebSocketStompClient stompClient;

	@Autowired
	private ObjectMapper objectMapper;

	@Autowired
	private TestRestTemplate restTemplate;

	private RelayChannelFactory channels;
	private final List<SessionCoordinator> coordinators = new ArrayList<>();

	@BeforeEach
	void setUp() {
		channels = new StompRelayChannelFactory(stompClient, "ws://localhost:" + port + "/ws");
	}

	@AfterEach
	void tearDown() throws Exception {
		for (SessionCoordinator coordinator : coordinators) {
			coordinator.shutdown().get(10, TimeUnit.SECONDS);
		}
	}

	@Test
	void twoPeersNegotiateThroughTheRelay() {
		SessionCoordinator alice = coordinator("a1", "brightforest3");
		SessionCoordinator bob = coordinator("b2", "brightforest3");

		alice.start().join();
		bob.start().join();

		await().atMost(WAIT).until(() -> alice.getPhase() == SessionState.CONNECTED
				&& bob.getPhase() == SessionState.CONNECTED);

		RoomStatusResponse room = restTemplate.getForObject("/api/rooms/brightforest3", RoomStatusResponse.class);
		assertThat(room.getParticipants()).isEqualTo(2);
		assertThat(room.getFull()).isTrue();
	}

	@Test
	void thirdParticipantIsKeptOut() {
		SessionCoordinator alice = coordinator("a1", "crowdedhall9");
		SessionCoordinator bob = coordinator("b2", "crowdedhall9");
		alice.start().join();
		bob.start().join();
		await().atMost(WAIT).until(() -> alice.getPhase() == SessionState.CONNECTED
				&& bob.getPhase() == SessionState.CONNECTED);

		SessionCoordinator carol = coordinator("c3", "crowdedhall9");
		carol.start().join();

		await().during(Duration.ofSeconds(1)).atMost(WAIT)
				.until(() -> carol.getPhase() == SessionState.AWAITING_COUNTERPART
						&& alice.getPhase() == SessionState.CONNECTED);
		RoomStatusResponse room = restTemplate.getForObject("/api/rooms/crowdedhall9", RoomStatusResponse.class);
		assertThat(room.getParticipants()).isEqualTo(2);
	}

	@Test
	void subscriptionIsAcknowledgedBeforeConnectCompletes() {
		SignalingRelayClient listener = relayClient("a1");
		SignalingRelayClient sender = relayClient("b2");
		List<SignalMessage> received = new CopyOnWriteArrayList<>();
		listener.onMessage(received::add);
		try {
			listener.connect(RoomIdentity.of("quietlake7")).join();
			sender.connect(RoomIdentity.of("quietlake7")).join();

			// published right away, no settling time for the listener's subscription
			sender.send(SignalKind.JOIN, null).join();

			await().atMost(WAIT).until(() -> !received.isEmpty());
			assertThat(received).singleElement().satisfies(message -> {
				assertThat(message.getKind()).isEqualTo(SignalKind.JOIN);
				assertThat(message.getSenderId()).isEqualTo("b2");
			});
		} finally {
			listener.disconnect().join();
			sender.disconnect().join();
		}
	}

	@Test
	void vanishedPeerIsAnnouncedAsLeaving() {
		SessionCoordinator alice = coordinator("a1", "emptyroom5");
		alice.start().join();

		SignalingRelayClient ghost = relayClient("b2");
		ghost.connect(RoomIdentity.of("emptyroom5")).join();
		ghost.send(SignalKind.JOIN, null).join();
		await().atMost(WAIT).until(() -> alice.getPhase() == SessionState.NEGOTIATING);

		// drop the connection without saying goodbye
		ghost.disconnect().join();

		await().atMost(WAIT).until(() -> alice.getPhase() == SessionState.AWAITING_COUNTERPART);
		assertThat(alice.getStatus().getError()).isEqualTo("Peer disconnected");
	}

	@Test
	void roomLookupRejectsMalformedNames() {
		ResponseEntity<String> response = restTemplate.getForEntity("/api/rooms/not.a.room", String.class);

		assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
		assertThat(response.getBody()).contains("Invalid room ID");
	}

	@Test
	void unknownRoomIsEmpty() {
		RoomStatusResponse room = restTemplate.getForObject("/api/rooms/nobodyhome1", RoomStatusResponse.class);

		assertThat(room.getParticipants()).isZero();
		assertThat(room.getFull()).isFalse();
	}

	private SignalingRelayClient relayClient(String id) {
		return new SignalingRelayClient(channels, PeerIdentity.of(id), Duration.ofSeconds(5), Duration.ofMillis(200));
	}

	private SessionCoordinator coordinator(String id, String room) {
		SessionCoordinator coordinator = SessionCoordinator.builder()
				.room(RoomIdentity.of(room))
				.relay(relayClient(id))
				.transportFactory(new FakeTransportFactory(id.toUpperCase()))
				.localMedia(LocalMedia.of(FakeMediaHandle.audioVideo()))
				.observer(new RecordingObserver())
				.settings(SETTINGS)
				.codec(new SignalPayloadCodec(objectMapper))
				.build();
		coordinators.add(coordinator);
		return coordinator;
	}
}
