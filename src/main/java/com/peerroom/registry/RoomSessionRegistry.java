package com.peerroom.registry;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Which relay session belongs to which participant of which room. A room holds at most two participants.
 */
@Component
@Slf4j
public class RoomSessionRegistry {

	public static final int ROOM_CAPACITY = 2;

	private final Map<String, RoomMembership> sessionMemberships = new ConcurrentHashMap<>();

	/**
	 * Record that the session's peer joined the room. Re-registering a known participant is fine.
	 *
	 * @return false when the room already hosts two other participants
	 */
	public synchronized boolean register(String sessionId, String roomId, String peerId) {
		Set<String> present = participants(roomId);
		if (!present.contains(peerId) && present.size() >= ROOM_CAPACITY) {
			return false;
		}
		RoomMembership previous = sessionMemberships.put(sessionId, new RoomMembership(roomId, peerId));
		if (previous == null || !previous.getRoomId().equals(roomId)) {
			log.debug("Session {} joined room {} as {}", sessionId, roomId, peerId);
		}
		return true;
	}

	public synchronized Optional<RoomMembership> removeBySessionId(String sessionId) {
		return Optional.ofNullable(sessionMemberships.remove(sessionId));
	}

	public synchronized void remove(String sessionId, String roomId) {
		sessionMemberships.computeIfPresent(sessionId,
				(id, membership) -> membership.getRoomId().equals(roomId) ? null : membership);
	}

	public Set<String> participants(String roomId) {
		return sessionMemberships.values().stream()
				.filter(membership -> membership.getRoomId().equals(roomId))
				.map(RoomMembership::getPeerId)
				.collect(Collectors.toSet());
	}

	public int getActiveSessionCount() {
		return sessionMemberships.size();
	}

	@Value
	public static class RoomMembership {
		String roomId;
		String peerId;
	}
}
