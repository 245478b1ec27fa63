package com.peerroom.negotiation;

import com.peerroom.media.MediaHandle;
import com.peerroom.model.PeerIdentity;
import com.peerroom.transport.SessionTransport;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;

/**
 * Everything the coordinator tracks across messages and transport callbacks, in one place.
 * Mutated only from the coordinator's event loop.
 */
@Getter
@Setter
class NegotiationState {

	private volatile SessionState phase = SessionState.IDLE;

	private SessionTransport transport;
	// Bumped on every transport replacement so callbacks from a discarded transport can be told apart
	private long transportGeneration;
	private boolean remoteDescriptionSet;

	private final CandidateQueue candidateQueue;
	private final ProcessedJoinSet processedJoins = new ProcessedJoinSet();

	private PeerIdentity counterpart;
	private NegotiationRole role;
	private PresenceAnnouncer presenceAnnouncer;

	private MediaHandle remoteMedia;
	private boolean remoteMediaExposed;

	NegotiationState(Duration transportTimeout) {
		this.candidateQueue = new CandidateQueue(transportTimeout);
	}

	long nextTransportGeneration() {
		return ++transportGeneration;
	}

	boolean isCurrentTransport(long generation) {
		return transport != null && generation == transportGeneration;
	}

	void clearCounterpart() {
		counterpart = null;
		role = null;
	}
}
