package com.peerroom.negotiation;

import com.peerroom.model.PeerIdentity;

/**
 * Decides which of two peers leads negotiation. Both peers evaluate it on the same pair of identities,
 * so exactly one of them ends up leading.
 */
public final class RoleResolver {

	private RoleResolver() {
	}

	/**
	 * FOLLOWER exactly when {@code self} orders after {@code peer}, LEADER otherwise
	 */
	public static NegotiationRole resolve(PeerIdentity self, PeerIdentity peer) {
		if (self.equals(peer)) {
			throw new IllegalArgumentException("Cannot resolve a role against our own identity: " + self);
		}
		return self.compareTo(peer) > 0 ? NegotiationRole.FOLLOWER : NegotiationRole.LEADER;
	}
}
