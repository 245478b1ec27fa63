package com.peerroom.negotiation;

import com.peerroom.model.PeerIdentity;
import com.peerroom.model.RoomIdentity;
import lombok.Value;

import java.util.HashSet;
import java.util.Set;

/**
 * Joins already acted upon, keyed by sender and room. Not thread-safe: only the event loop touches it.
 */
class ProcessedJoinSet {

	private final Set<JoinKey> processed = new HashSet<>();

	/**
	 * @return true when this is the first join seen for the key
	 */
	boolean markProcessed(PeerIdentity sender, RoomIdentity room) {
		return processed.add(new JoinKey(sender, room));
	}

	boolean contains(PeerIdentity sender, RoomIdentity room) {
		return processed.contains(new JoinKey(sender, room));
	}

	void forget(PeerIdentity sender, RoomIdentity room) {
		processed.remove(new JoinKey(sender, room));
	}

	void forgetRoom(RoomIdentity room) {
		processed.removeIf(key -> key.getRoom().equals(room));
	}

	int size() {
		return processed.size();
	}

	@Value
	private static class JoinKey {
		PeerIdentity sender;
		RoomIdentity room;
	}
}
