package com.peerroom.controller;

import com.peerroom.dto.SignalKind;
import com.peerroom.dto.SignalMessage;
import com.peerroom.metrics.SignalMetricsTracker;
import com.peerroom.model.RoomIdentity;
import com.peerroom.registry.RoomSessionRegistry;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Controller;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * The room relay: every signal published to a room is broadcast to all of the room's subscribers.
 * The relay never interprets payloads.
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class SignalRelayController {

	private final RoomSessionRegistry roomSessionRegistry;
	private final SimpMessagingTemplate messagingTemplate;
	private final SignalMetricsTracker signalMetricsTracker;
	private final Validator validator;

	public static String topicFor(String roomId) {
		return "/topic/room/" + roomId;
	}

	/**
	 * Client sends to: /app/room/{roomId}/signal
	 */
	@MessageMapping("/room/{roomId}/signal")
	public void relaySignal(@DestinationVariable String roomId, @Payload SignalMessage message,
			SimpMessageHeaderAccessor headers) {
		if (message == null) {
			log.warn("Received empty signal for room {}", roomId);
			signalMetricsTracker.recordDropped();
			return;
		}

		Set<ConstraintViolation<SignalMessage>> violations = validator.validate(message);
		if (!violations.isEmpty()) {
			log.warn("Dropping invalid signal {}: {}", message, violations.stream()
					.map(ConstraintViolation::getMessage)
					.collect(Collectors.joining(", ")));
			signalMetricsTracker.recordDropped();
			return;
		}
		if (!RoomIdentity.isValid(roomId) || !roomId.equals(message.getRoomId())) {
			log.warn("Dropping signal for room {} published to room {}", message.getRoomId(), roomId);
			signalMetricsTracker.recordDropped();
			return;
		}

		String sessionId = headers.getSessionId();
		if (!trackMembership(sessionId, message)) {
			signalMetricsTracker.recordDropped();
			return;
		}

		try {
			messagingTemplate.convertAndSend(topicFor(roomId), message);
			signalMetricsTracker.record(message.getKind());
			log.debug("Relayed {} from {} in room {}", message.getKind(), message.getSenderId(), roomId);
		} catch (Exception e) {
			log.error("Error relaying {} in room {}: {}", message.getKind(), roomId, e.getMessage(), e);
		}
	}

	private boolean trackMembership(String sessionId, SignalMessage message) {
		if (sessionId == null) {
			return true;
		}
		if (message.getKind() == SignalKind.LEAVE) {
			roomSessionRegistry.remove(sessionId, message.getRoomId());
			return true;
		}
		if (message.getKind() == SignalKind.JOIN
				&& !roomSessionRegistry.register(sessionId, message.getRoomId(), message.getSenderId())) {
			log.warn("Room {} is full, dropping join from {}", message.getRoomId(), message.getSenderId());
			return false;
		}
		return true;
	}
}
