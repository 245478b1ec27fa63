package com.peerroom.negotiation;

import com.peerroom.dto.IceCandidate;
import com.peerroom.dto.SessionDescription;
import com.peerroom.model.PeerIdentity;
import com.peerroom.support.FakeSessionTransport;
import com.peerroom.transport.ConnectionState;
import com.peerroom.transport.TransportListener;
import com.peerroom.media.MediaHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateQueueTest {

	private final TransportListener ignoring = new TransportListener() {
		@Override
		public void onIceCandidate(IceCandidate candidate) {
		}

		@Override
		public void onConnectionStateChange(ConnectionState state) {
		}

		@Override
		public void onRemoteMedia(MediaHandle remoteMedia) {
		}
	};

	private CandidateQueue queue;
	private FakeSessionTransport transport;

	@BeforeEach
	void setUp() {
		queue = new CandidateQueue();
		transport = new FakeSessionTransport("t", ignoring, false, false);
		transport.setRemoteDescription(SessionDescription.offer("remote"));
	}

	@Test
	void drainsInArrivalOrder() {
		queue.enqueue(candidate("c1"));
		queue.enqueue(candidate("c2"));
		queue.enqueue(candidate("c3"));

		int applied = queue.drainInto(transport).join();

		assertThat(applied).isEqualTo(3);
		assertThat(transport.getAppliedCandidates())
				.extracting(IceCandidate::getCandidate)
				.containsExactly("c1", "c2", "c3");
		assertThat(queue.isEmpty()).isTrue();
	}

	@Test
	void rejectedCandidateDoesNotStopTheRest() {
		queue.enqueue(candidate("c1"));
		queue.enqueue(candidate("bad-one"));
		queue.enqueue(candidate("c3"));

		int applied = queue.drainInto(transport).join();

		assertThat(applied).isEqualTo(2);
		assertThat(transport.getAppliedCandidates())
				.extracting(IceCandidate::getCandidate)
				.containsExactly("c1", "c3");
	}

	@Test
	void drainingEmptyQueueAppliesNothing() {
		assertThat(queue.drainInto(transport).join()).isZero();
		assertThat(transport.getAppliedCandidates()).isEmpty();
	}

	@Test
	void clearDropsPendingCandidates() {
		queue.enqueue(candidate("c1"));
		queue.clear();

		assertThat(queue.size()).isZero();
		assertThat(queue.drainInto(transport).join()).isZero();
	}

	@Test
	void candidatesFromOtherSendersAreDroppedOnceCounterpartIsKnown() {
		queue.enqueue(PeerIdentity.of("y8"), candidate("from-y8"));
		queue.enqueue(PeerIdentity.of("z9"), candidate("from-z9"));
		queue.enqueue(PeerIdentity.of("y8"), candidate("again-y8"));

		assertThat(queue.retainFrom(PeerIdentity.of("z9"))).isEqualTo(2);
		queue.drainInto(transport).join();

		assertThat(transport.getAppliedCandidates())
				.extracting(IceCandidate::getCandidate)
				.containsExactly("from-z9");
	}

	@Test
	void fullQueueRejectsFurtherCandidates() {
		for (int i = 0; i < CandidateQueue.MAX_PENDING; i++) {
			assertThat(queue.enqueue(PeerIdentity.of("z9"), candidate("c" + i))).isTrue();
		}

		assertThat(queue.enqueue(PeerIdentity.of("z9"), candidate("overflow"))).isFalse();
		assertThat(queue.size()).isEqualTo(CandidateQueue.MAX_PENDING);
	}

	@Test
	void candidateThatNeverSettlesIsSkipped() {
		CandidateQueue bounded = new CandidateQueue(Duration.ofMillis(100));
		bounded.enqueue(candidate("stuck-one"));
		bounded.enqueue(candidate("c2"));

		int applied = bounded.drainInto(transport).join();

		assertThat(applied).isEqualTo(1);
		assertThat(transport.getAppliedCandidates())
				.extracting(IceCandidate::getCandidate)
				.containsExactly("c2");
	}

	private static IceCandidate candidate(String value) {
		return IceCandidate.builder().candidate(value).sdpMid("0").sdpMLineIndex(0).build();
	}
}
