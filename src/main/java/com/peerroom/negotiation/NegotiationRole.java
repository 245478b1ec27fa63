package com.peerroom.negotiation;

public enum NegotiationRole {
	/**
	 * Impolite side: creates and sends the offer.
	 */
	LEADER,
	/**
	 * Polite side: waits for the offer and answers it.
	 */
	FOLLOWER
}
