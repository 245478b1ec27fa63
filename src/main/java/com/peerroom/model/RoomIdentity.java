package com.peerroom.model;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.regex.Pattern;

/**
 * Room name shared out-of-band between the two participants. Also names the relay topic.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class RoomIdentity {

	private static final Pattern VALID_ROOM = Pattern.compile("[A-Za-z0-9_-]{1,64}");

	private final String value;

	public static RoomIdentity of(String value) {
		if (!isValid(value)) {
			throw new IllegalArgumentException("Invalid room ID: " + value);
		}
		return new RoomIdentity(value);
	}

	public static boolean isValid(String value) {
		return value != null && VALID_ROOM.matcher(value).matches();
	}

	@Override
	public String toString() {
		return value;
	}
}
