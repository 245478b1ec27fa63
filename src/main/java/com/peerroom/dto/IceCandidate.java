package com.peerroom.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A discovered network path, as produced by the local session transport.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IceCandidate {

	String candidate;

	String sdpMid;

	@JsonProperty("sdpMLineIndex")
	Integer sdpMLineIndex;
}
