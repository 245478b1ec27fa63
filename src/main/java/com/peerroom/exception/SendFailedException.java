package com.peerroom.exception;

import com.peerroom.dto.SignalKind;
import lombok.Getter;

@Getter
public class SendFailedException extends SignalingException {

	private final SignalKind kind;

	public SendFailedException(SignalKind kind, String reason) {
		super("Failed to send " + kind.getWireName() + ": " + reason);
		this.kind = kind;
	}

	public SendFailedException(SignalKind kind, String reason, Throwable cause) {
		super("Failed to send " + kind.getWireName() + ": " + reason, cause);
		this.kind = kind;
	}
}
