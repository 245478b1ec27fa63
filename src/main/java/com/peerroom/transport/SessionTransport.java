package com.peerroom.transport;

import com.peerroom.dto.IceCandidate;
import com.peerroom.dto.SessionDescription;
import com.peerroom.media.MediaHandle;

import java.util.concurrent.CompletableFuture;

/**
 * One negotiation attempt and, once it succeeds, the direct channel between the two peers.
 * A closed transport is never reused.
 */
public interface SessionTransport {

	SignalingState signalingState();

	CompletableFuture<SessionDescription> createOffer();

	CompletableFuture<SessionDescription> createAnswer();

	CompletableFuture<Void> setLocalDescription(SessionDescription description);

	/**
	 * Discard a pending local offer and return to {@link SignalingState#STABLE}
	 */
	CompletableFuture<Void> rollback();

	CompletableFuture<Void> setRemoteDescription(SessionDescription description);

	CompletableFuture<Void> addIceCandidate(IceCandidate candidate);

	/**
	 * Attach the local tracks, replacing any already bound track of the same kind
	 */
	void bindLocalMedia(MediaHandle media);

	void close();
}
