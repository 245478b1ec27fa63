package com.peerroom.negotiation;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class NegotiationSettings {

	@Builder.Default
	Duration presenceInterval = Duration.ofSeconds(2);

	@Builder.Default
	int presenceRetries = 5;

	@Builder.Default
	Duration mediaWaitTimeout = Duration.ofSeconds(3);

	@Builder.Default
	Duration leaveGrace = Duration.ofSeconds(1);

	/**
	 * Upper bound on any single offer, answer, description or candidate operation of the session transport
	 */
	@Builder.Default
	Duration transportTimeout = Duration.ofSeconds(10);
}
