package com.peerroom.negotiation;

public enum SessionState {
	IDLE,
	AWAITING_COUNTERPART,
	NEGOTIATING,
	CONNECTED,
	/**
	 * Relay subscription failed; {@link SessionCoordinator#start()} may be retried.
	 */
	FAILED,
	/**
	 * Removed by the counterpart.
	 */
	REMOVED,
	CLOSED;

	public boolean isActive() {
		return this == AWAITING_COUNTERPART || this == NEGOTIATING || this == CONNECTED;
	}
}
