package com.peerroom.exception;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Maps failures of the room lookup API to JSON bodies. Negotiation failures never reach here,
 * they are surfaced through the session status instead.
 */
@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

	@ExceptionHandler(IllegalArgumentException.class)
	public ResponseEntity<ErrorResponse> handleInvalidRoom(IllegalArgumentException ex) {
		log.warn("Rejected room request: {}", ex.getMessage());
		return respond(HttpStatus.BAD_REQUEST, "invalid_request", ex.getMessage());
	}

	@ExceptionHandler(Exception.class)
	public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
		log.error("Unhandled error while serving room API", ex);
		return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Internal server error");
	}

	private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message) {
		return ResponseEntity.status(status).body(new ErrorResponse(code, message));
	}

	@Data
	@NoArgsConstructor
	@AllArgsConstructor
	public static class ErrorResponse {
		private String code;
		private String message;
	}
}
