package com.peerroom.transport;

import com.peerroom.dto.IceCandidate;
import com.peerroom.media.MediaHandle;

/**
 * Callbacks a session transport raises. Implementations may be invoked from any thread.
 */
public interface TransportListener {

	void onIceCandidate(IceCandidate candidate);

	void onConnectionStateChange(ConnectionState state);

	void onRemoteMedia(MediaHandle remoteMedia);
}
