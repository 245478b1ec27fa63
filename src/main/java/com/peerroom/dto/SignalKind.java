package com.peerroom.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of messages exchanged over the room relay, with their wire names.
 */
public enum SignalKind {
	JOIN("join"),
	OFFER("offer"),
	ANSWER("answer"),
	ICE_CANDIDATE("ice-candidate"),
	LEAVE("leave"),
	KICK("kick");

	private final String wireName;

	SignalKind(String wireName) {
		this.wireName = wireName;
	}

	@JsonValue
	public String getWireName() {
		return wireName;
	}

	@JsonCreator
	public static SignalKind fromWireName(String wireName) {
		for (SignalKind kind : values()) {
			if (kind.wireName.equals(wireName)) {
				return kind;
			}
		}
		throw new IllegalArgumentException("Unknown signal kind: " + wireName);
	}
}
