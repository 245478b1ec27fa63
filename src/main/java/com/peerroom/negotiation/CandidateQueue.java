package com.peerroom.negotiation;

import com.peerroom.dto.IceCandidate;
import com.peerroom.exception.SignalingException;
import com.peerroom.model.PeerIdentity;
import com.peerroom.transport.SessionTransport;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Remote candidates that arrived before the transport had a remote description.
 * Scoped to one transport; cleared whenever the transport is replaced.
 */
@Slf4j
public class CandidateQueue {

	static final int MAX_PENDING = 64;
	private static final Duration DEFAULT_APPLY_TIMEOUT = Duration.ofSeconds(10);

	private final Deque<Pending> pending = new ArrayDeque<>();
	private final Duration applyTimeout;

	public CandidateQueue() {
		this(DEFAULT_APPLY_TIMEOUT);
	}

	public CandidateQueue(Duration applyTimeout) {
		this.applyTimeout = applyTimeout;
	}

	public void enqueue(IceCandidate candidate) {
		enqueue(null, candidate);
	}

	/**
	 * Queue a candidate together with the peer that sent it, so it can be dropped if that peer
	 * does not become the counterpart.
	 *
	 * @return false when the queue is full and the candidate was dropped
	 */
	public boolean enqueue(PeerIdentity sender, IceCandidate candidate) {
		if (pending.size() >= MAX_PENDING) {
			log.warn("ICE candidate queue full ({}), dropping candidate from {}", MAX_PENDING, sender);
			return false;
		}
		pending.addLast(new Pending(sender, candidate));
		log.debug("Queued ICE candidate from {}, {} pending", sender, pending.size());
		return true;
	}

	/**
	 * Keep only the candidates sent by {@code counterpart}, plus those queued without a sender.
	 *
	 * @return number of candidates dropped
	 */
	public int retainFrom(PeerIdentity counterpart) {
		int before = pending.size();
		pending.removeIf(entry -> entry.getSender() != null && !entry.getSender().equals(counterpart));
		int dropped = before - pending.size();
		if (dropped > 0) {
			log.debug("Dropped {} queued ICE candidate(s) not sent by {}", dropped, counterpart);
		}
		return dropped;
	}

	/**
	 * Apply every queued candidate in arrival order, one after another. A candidate the transport rejects,
	 * or does not settle within the apply timeout, is logged and skipped; the rest still get applied.
	 *
	 * @return number of candidates the transport accepted
	 */
	public CompletableFuture<Integer> drainInto(SessionTransport transport) {
		if (pending.isEmpty()) {
			return CompletableFuture.completedFuture(0);
		}
		List<Pending> batch = new ArrayList<>(pending);
		pending.clear();
		log.debug("Applying {} queued ICE candidate(s)", batch.size());

		CompletableFuture<Integer> chain = CompletableFuture.completedFuture(0);
		for (Pending entry : batch) {
			chain = chain.thenCompose(applied -> apply(transport, entry.getCandidate())
					.thenApply(accepted -> accepted ? applied + 1 : applied));
		}
		return chain;
	}

	public void clear() {
		pending.clear();
	}

	public int size() {
		return pending.size();
	}

	public boolean isEmpty() {
		return pending.isEmpty();
	}

	private CompletableFuture<Boolean> apply(SessionTransport transport, IceCandidate candidate) {
		CompletableFuture<Void> attempt;
		try {
			attempt = transport.addIceCandidate(candidate).copy()
					.orTimeout(applyTimeout.toMillis(), TimeUnit.MILLISECONDS);
		} catch (RuntimeException e) {
			attempt = CompletableFuture.failedFuture(e);
		}
		return attempt.handle((ignored, ex) -> {
			if (ex != null) {
				log.warn("Failed to add queued ICE candidate {}: {}", candidate.getCandidate(),
						SignalingException.unwrap(ex).toString());
				return false;
			}
			return true;
		});
	}

	@Value
	private static class Pending {
		PeerIdentity sender;
		IceCandidate candidate;
	}
}
