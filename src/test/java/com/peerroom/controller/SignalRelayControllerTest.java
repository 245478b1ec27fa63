package com.peerroom.controller;

import com.peerroom.dto.SignalKind;
import com.peerroom.dto.SignalMessage;
import com.peerroom.metrics.SignalMetricsTracker;
import com.peerroom.registry.RoomSessionRegistry;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import jakarta.validation.ValidatorFactory;

import static com.peerroom.support.TestSessions.signal;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class SignalRelayControllerTest {

	private static final ValidatorFactory VALIDATION = Validation.buildDefaultValidatorFactory();

	private RoomSessionRegistry registry;
	private SimpMessagingTemplate messagingTemplate;
	private SignalMetricsTracker metrics;
	private SignalRelayController controller;

	@BeforeEach
	void setUp() {
		registry = new RoomSessionRegistry();
		messagingTemplate = mock(SimpMessagingTemplate.class);
		metrics = new SignalMetricsTracker(registry);
		Validator validator = VALIDATION.getValidator();
		controller = new SignalRelayController(registry, messagingTemplate, metrics, validator);
	}

	@AfterAll
	static void closeValidation() {
		VALIDATION.close();
	}

	@Test
	void broadcastsToRoomTopicAndRecordsMembership() {
		SignalMessage join = signal(SignalKind.JOIN, "sunnyriver42", "a1", null);

		controller.relaySignal("sunnyriver42", join, session("s1"));

		verify(messagingTemplate).convertAndSend("/topic/room/sunnyriver42", join);
		assertThat(registry.participants("sunnyriver42")).containsExactly("a1");
		assertThat(metrics.drainCounts()).containsEntry(SignalKind.JOIN, 1L);
	}

	@Test
	void dropsJoinFromThirdParticipant() {
		controller.relaySignal("sunnyriver42", signal(SignalKind.JOIN, "sunnyriver42", "a1", null), session("s1"));
		controller.relaySignal("sunnyriver42", signal(SignalKind.JOIN, "sunnyriver42", "b2", null), session("s2"));
		SignalMessage intruder = signal(SignalKind.JOIN, "sunnyriver42", "c3", null);

		controller.relaySignal("sunnyriver42", intruder, session("s3"));

		verify(messagingTemplate, never()).convertAndSend("/topic/room/sunnyriver42", intruder);
		assertThat(registry.participants("sunnyriver42")).containsExactlyInAnyOrder("a1", "b2");
	}

	@Test
	void leaveForgetsMembership() {
		controller.relaySignal("sunnyriver42", signal(SignalKind.JOIN, "sunnyriver42", "a1", null), session("s1"));

		controller.relaySignal("sunnyriver42", signal(SignalKind.LEAVE, "sunnyriver42", "a1", null), session("s1"));

		assertThat(registry.participants("sunnyriver42")).isEmpty();
	}

	@Test
	void dropsMessagesFailingValidation() {
		SignalMessage anonymous = SignalMessage.builder().kind(SignalKind.OFFER).roomId("sunnyriver42").build();

		controller.relaySignal("sunnyriver42", anonymous, session("s1"));

		verify(messagingTemplate, never()).convertAndSend(anyString(), any(Object.class));
	}

	@Test
	void dropsMessagesPublishedToAnotherRoom() {
		controller.relaySignal("quietlake7", signal(SignalKind.JOIN, "sunnyriver42", "a1", null), session("s1"));

		verify(messagingTemplate, never()).convertAndSend(anyString(), any(Object.class));
		assertThat(registry.getActiveSessionCount()).isZero();
	}

	private static SimpMessageHeaderAccessor session(String sessionId) {
		SimpMessageHeaderAccessor accessor = SimpMessageHeaderAccessor.create();
		accessor.setSessionId(sessionId);
		return accessor;
	}
}
