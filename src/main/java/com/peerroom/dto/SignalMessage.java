package com.peerroom.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One message on a room relay. The payload carries a session description for offers and answers,
 * a network candidate for ice-candidate messages, and is absent otherwise.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SignalMessage {

	@NotNull(message = "Signal kind is required")
	SignalKind kind;

	JsonNode payload;

	@NotBlank(message = "Room ID is required")
	String roomId;

	@NotBlank(message = "Sender ID is required")
	String senderId;

	/**
	 * Keep SDP blobs out of the logs
	 */
	@Override
	public String toString() {
		return "SignalMessage{kind=" + kind
				+ ", roomId='" + roomId + '\''
				+ ", senderId='" + senderId + '\''
				+ (payload != null ? ", payload=<signal_data>" : "")
				+ '}';
	}
}
