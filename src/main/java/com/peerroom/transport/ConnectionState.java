package com.peerroom.transport;

public enum ConnectionState {
	NEW,
	CONNECTING,
	CONNECTED,
	DISCONNECTED,
	FAILED,
	CLOSED;

	/**
	 * Whether the transport can no longer carry the session
	 */
	public boolean isTerminal() {
		return this == DISCONNECTED || this == FAILED || this == CLOSED;
	}
}
