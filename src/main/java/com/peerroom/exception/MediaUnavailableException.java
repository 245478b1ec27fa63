package com.peerroom.exception;

public class MediaUnavailableException extends SignalingException {

	public MediaUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}
}
