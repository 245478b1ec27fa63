package com.peerroom.exception;

/**
 * The local session transport rejected an offer, answer or description.
 */
public class NegotiationFailedException extends SignalingException {

	public NegotiationFailedException(String message, Throwable cause) {
		super(message, cause);
	}
}
