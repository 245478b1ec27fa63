package com.peerroom.negotiation;

import lombok.Value;
import lombok.With;

/**
 * What the presentation layer shows for the session.
 */
@Value
@With
public class SessionStatus {

	boolean connected;

	boolean connecting;

	String error;

	public static SessionStatus idle() {
		return new SessionStatus(false, false, null);
	}

	public static SessionStatus connecting() {
		return new SessionStatus(false, true, null);
	}

	public static SessionStatus established() {
		return new SessionStatus(true, false, null);
	}

	public static SessionStatus interrupted(String error) {
		return new SessionStatus(false, false, error);
	}
}
