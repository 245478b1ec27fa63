package com.peerroom.exception;

import com.peerroom.model.RoomIdentity;
import lombok.Getter;

/**
 * The relay channel for a room could not be subscribed. Fatal to one connection attempt only.
 */
@Getter
public class RelayUnavailableException extends SignalingException {

	private final RoomIdentity room;

	public RelayUnavailableException(RoomIdentity room, String reason, Throwable cause) {
		super("Relay unavailable for room " + room + ": " + reason, cause);
		this.room = room;
	}
}
