package com.peerroom.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Converts between typed negotiation payloads and the opaque JSON payload of a {@link SignalMessage}.
 */
@Slf4j
@RequiredArgsConstructor
public class SignalPayloadCodec {

	private final ObjectMapper objectMapper;

	public JsonNode encode(Object payload) {
		return objectMapper.valueToTree(payload);
	}

	/**
	 * Decode a payload, or empty when it is missing or does not match the expected shape
	 */
	public <T> Optional<T> decode(JsonNode payload, Class<T> type) {
		if (payload == null || payload.isNull()) {
			return Optional.empty();
		}
		try {
			return Optional.ofNullable(objectMapper.treeToValue(payload, type));
		} catch (Exception e) {
			log.warn("Malformed {} payload: {}", type.getSimpleName(), e.getMessage());
			return Optional.empty();
		}
	}
}
