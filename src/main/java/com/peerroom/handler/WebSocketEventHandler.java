package com.peerroom.handler;

import com.peerroom.controller.SignalRelayController;
import com.peerroom.dto.SignalKind;
import com.peerroom.dto.SignalMessage;
import com.peerroom.metrics.SignalMetricsTracker;
import com.peerroom.registry.RoomSessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

@Component
@RequiredArgsConstructor
@Slf4j
public class WebSocketEventHandler {

	private final RoomSessionRegistry roomSessionRegistry;
	private final SimpMessagingTemplate messagingTemplate;
	private final SignalMetricsTracker signalMetricsTracker;

	@EventListener
	public void handleWebSocketConnectListener(SessionConnectedEvent event) {
		StompHeaderAccessor headerAccessor = StompHeaderAccessor.wrap(event.getMessage());
		log.info("WebSocket session connected: {}", headerAccessor.getSessionId());
	}

	/**
	 * A participant that vanished without saying goodbye is announced as leaving, so the one left behind
	 * can wait for the next counterpart right away.
	 */
	@EventListener
	public void handleWebSocketDisconnectListener(SessionDisconnectEvent event) {
		String sessionId = event.getSessionId();
		log.info("WebSocket session disconnected: {} ({})", sessionId, event.getCloseStatus());

		roomSessionRegistry.removeBySessionId(sessionId).ifPresent(membership -> {
			SignalMessage leave = SignalMessage.builder()
					.kind(SignalKind.LEAVE)
					.roomId(membership.getRoomId())
					.senderId(membership.getPeerId())
					.build();
			try {
				messagingTemplate.convertAndSend(SignalRelayController.topicFor(membership.getRoomId()), leave);
				signalMetricsTracker.record(SignalKind.LEAVE);
				log.info("Announced departure of {} from room {}", membership.getPeerId(), membership.getRoomId());
			} catch (Exception e) {
				log.error("Failed to announce departure of {}: {}", membership.getPeerId(), e.getMessage(), e);
			}
		});
	}
}
