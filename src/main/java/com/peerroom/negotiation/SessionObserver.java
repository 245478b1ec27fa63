package com.peerroom.negotiation;

import com.peerroom.media.MediaHandle;

/**
 * Presentation collaborator. Callbacks arrive on the session's event loop thread.
 */
public interface SessionObserver {

	void onStatusChanged(SessionStatus status);

	/**
	 * The remote stream once the session is connected, {@code null} when it went away
	 */
	default void onRemoteMedia(MediaHandle remoteMedia) {
	}

	/**
	 * The counterpart removed us from the room. The session tears itself down right after.
	 */
	default void onRemoved() {
	}
}
