package com.peerroom.registry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RoomSessionRegistryTest {

	private RoomSessionRegistry registry;

	@BeforeEach
	void setUp() {
		registry = new RoomSessionRegistry();
	}

	@Test
	void roomHoldsTwoParticipants() {
		assertThat(registry.register("s1", "sunnyriver42", "a1")).isTrue();
		assertThat(registry.register("s2", "sunnyriver42", "b2")).isTrue();

		assertThat(registry.register("s3", "sunnyriver42", "c3")).isFalse();
		assertThat(registry.participants("sunnyriver42")).containsExactlyInAnyOrder("a1", "b2");
	}

	@Test
	void repeatedJoinOfKnownParticipantIsAccepted() {
		registry.register("s1", "sunnyriver42", "a1");
		registry.register("s2", "sunnyriver42", "b2");

		assertThat(registry.register("s1", "sunnyriver42", "a1")).isTrue();
		assertThat(registry.getActiveSessionCount()).isEqualTo(2);
	}

	@Test
	void roomsAreIndependent() {
		registry.register("s1", "sunnyriver42", "a1");
		registry.register("s2", "sunnyriver42", "b2");

		assertThat(registry.register("s3", "quietlake7", "c3")).isTrue();
		assertThat(registry.participants("quietlake7")).containsExactly("c3");
	}

	@Test
	void removingSessionFreesItsSeat() {
		registry.register("s1", "sunnyriver42", "a1");
		registry.register("s2", "sunnyriver42", "b2");

		assertThat(registry.removeBySessionId("s2"))
				.hasValueSatisfying(membership -> {
					assertThat(membership.getRoomId()).isEqualTo("sunnyriver42");
					assertThat(membership.getPeerId()).isEqualTo("b2");
				});
		assertThat(registry.removeBySessionId("s2")).isEmpty();
		assertThat(registry.register("s3", "sunnyriver42", "c3")).isTrue();
	}

	@Test
	void leaveOnlyForgetsMatchingRoom() {
		registry.register("s1", "sunnyriver42", "a1");

		registry.remove("s1", "quietlake7");
		assertThat(registry.participants("sunnyriver42")).containsExactly("a1");

		registry.remove("s1", "sunnyriver42");
		assertThat(registry.participants("sunnyriver42")).isEmpty();
		assertThat(registry.getActiveSessionCount()).isZero();
	}
}
