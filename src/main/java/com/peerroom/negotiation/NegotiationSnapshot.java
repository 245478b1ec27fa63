package com.peerroom.negotiation;

import com.peerroom.model.PeerIdentity;
import lombok.Value;

/**
 * Point-in-time view of a coordinator, taken on its event loop.
 */
@Value
public class NegotiationSnapshot {

	SessionState phase;

	NegotiationRole role;

	PeerIdentity counterpart;

	int queuedCandidates;

	boolean remoteDescriptionSet;

	int processedJoins;

	long transportGeneration;
}
