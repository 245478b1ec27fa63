package com.peerroom.transport;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Address-discovery (STUN) or relay-traversal (TURN) server handed to the session transport.
 */
@Value
@Builder
public class IceServer {

	@Singular
	List<String> urls;

	String username;

	String credential;
}
