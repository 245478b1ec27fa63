package com.peerroom.model;

/**
 * Handle returned when registering a listener. Removing twice is a no-op.
 */
@FunctionalInterface
public interface Registration {

	void remove();
}
