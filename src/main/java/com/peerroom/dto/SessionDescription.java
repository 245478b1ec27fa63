package com.peerroom.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class SessionDescription {

	public static final String OFFER = "offer";
	public static final String ANSWER = "answer";

	String type;

	String sdp;

	public static SessionDescription offer(String sdp) {
		return new SessionDescription(OFFER, sdp);
	}

	public static SessionDescription answer(String sdp) {
		return new SessionDescription(ANSWER, sdp);
	}
}
