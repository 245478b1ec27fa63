package com.peerroom.model;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.math.BigInteger;
import java.security.SecureRandom;

/**
 * Opaque identity of one participant for one process run.
 * Identities are ordered lexicographically; that order is what breaks symmetry between two peers.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class PeerIdentity implements Comparable<PeerIdentity> {

	private static final SecureRandom RANDOM = new SecureRandom();

	private final String value;

	public static PeerIdentity of(String value) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("Peer ID must not be blank");
		}
		return new PeerIdentity(value);
	}

	/**
	 * Generate a short random base-36 token, e.g. "k3x9q0ab"
	 */
	public static PeerIdentity random() {
		String token = new BigInteger(41, RANDOM).toString(36);
		return new PeerIdentity(token.isEmpty() ? "0" : token);
	}

	@Override
	public int compareTo(PeerIdentity other) {
		return value.compareTo(other.value);
	}

	@Override
	public String toString() {
		return value;
	}
}
