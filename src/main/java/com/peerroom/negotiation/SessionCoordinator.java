package com.peerroom.negotiation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.peerroom.dto.IceCandidate;
import com.peerroom.dto.SessionDescription;
import com.peerroom.dto.SignalKind;
import com.peerroom.dto.SignalMessage;
import com.peerroom.dto.SignalPayloadCodec;
import com.peerroom.exception.NegotiationFailedException;
import com.peerroom.exception.RelayUnavailableException;
import com.peerroom.exception.SignalingException;
import com.peerroom.media.LocalMedia;
import com.peerroom.media.MediaHandle;
import com.peerroom.media.MediaKind;
import com.peerroom.media.MediaTrack;
import com.peerroom.exception.MediaUnavailableException;
import com.peerroom.model.PeerIdentity;
import com.peerroom.model.Registration;
import com.peerroom.model.RoomIdentity;
import com.peerroom.relay.SignalingRelayClient;
import com.peerroom.transport.ConnectionState;
import com.peerroom.transport.SessionTransport;
import com.peerroom.transport.SessionTransportFactory;
import com.peerroom.transport.SignalingState;
import com.peerroom.transport.TransportConfiguration;
import com.peerroom.transport.TransportListener;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Negotiation state machine for one room membership.
 *
 * <p>Owns the session transport, the relay client and the presence announcer. Relay messages, transport
 * callbacks, media changes and timer ticks are all fed through one {@link SignalingEventLoop}, so no two of
 * them are ever processed at the same time, even while a step waits on the transport or the relay.
 *
 * <p>States: IDLE, AWAITING_COUNTERPART, NEGOTIATING, CONNECTED. A peer leaving or a transport failure
 * returns to AWAITING_COUNTERPART with a fresh transport, so the room can host the next counterpart.
 */
@Slf4j
public class SessionCoordinator implements AutoCloseable {

	private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

	@Getter
	private final RoomIdentity room;
	@Getter
	private final PeerIdentity self;
	private final SignalingRelayClient relay;
	private final SessionTransportFactory transportFactory;
	private final TransportConfiguration transportConfiguration;
	private final LocalMedia localMedia;
	private final SessionObserver observer;
	private final NegotiationSettings settings;
	private final SignalPayloadCodec codec;

	private final ThreadPoolTaskScheduler scheduler;
	private final SignalingEventLoop loop;
	private final NegotiationState state;
	private final CompletableFuture<Void> terminated = new CompletableFuture<>();
	private final AtomicBoolean tearingDown = new AtomicBoolean();

	@Getter
	private volatile SessionStatus status = SessionStatus.idle();
	private volatile MediaHandle exposedRemoteMedia;
	private Registration messageRegistration;
	private Registration mediaRegistration;

	@Builder
	private SessionCoordinator(RoomIdentity room, SignalingRelayClient relay, SessionTransportFactory transportFactory,
			TransportConfiguration transportConfiguration, LocalMedia localMedia, SessionObserver observer,
			NegotiationSettings settings, SignalPayloadCodec codec) {
		if (room == null || relay == null || transportFactory == null) {
			throw new IllegalArgumentException("Room, relay client and transport factory are required");
		}
		this.room = room;
		this.self = relay.getSelf();
		this.relay = relay;
		this.transportFactory = transportFactory;
		this.transportConfiguration = transportConfiguration != null
				? transportConfiguration
				: TransportConfiguration.builder().build();
		this.localMedia = localMedia != null ? localMedia : LocalMedia.pending();
		this.observer = observer != null ? observer : ignored -> { };
		this.settings = settings != null ? settings : NegotiationSettings.builder().build();
		this.codec = codec != null ? codec : new SignalPayloadCodec(new ObjectMapper());
		this.state = new NegotiationState(this.settings.getTransportTimeout());
		this.scheduler = createScheduler(room);
		this.loop = new SignalingEventLoop(scheduler);
	}

	/**
	 * Subscribe to the room and start announcing presence. Completes exceptionally with
	 * {@link RelayUnavailableException} when the relay cannot be subscribed; the coordinator then sits in
	 * {@link SessionState#FAILED} and start may be called again.
	 */
	public CompletableFuture<Void> start() {
		synchronized (this) {
			if (messageRegistration == null) {
				messageRegistration = relay.onMessage(this::enqueueMessage);
				mediaRegistration = localMedia.addListener(new LocalMediaBinding());
			}
		}
		return loop.submit("start", this::joinRoom);
	}

	/**
	 * Leave the room: announce it best-effort, close the transport, release the relay subscription and stop
	 * all timers. Every release is attempted even when an earlier one fails.
	 */
	public CompletableFuture<Void> shutdown() {
		if (!tearingDown.compareAndSet(false, true)) {
			return terminated;
		}
		SessionState phase = state.getPhase();
		if (phase == SessionState.IDLE || phase == SessionState.FAILED) {
			// A connect may be in flight on the loop; release it so the teardown step is not stuck behind it
			relay.disconnect();
		}
		loop.submit("teardown", () -> releaseResources(true))
				.whenComplete((ignored, ex) -> finishTermination());
		return terminated;
	}

	@Override
	public void close() {
		try {
			shutdown().get(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			log.warn("Interrupted while leaving room {}", room);
		} catch (ExecutionException | TimeoutException e) {
			log.warn("Room {} did not shut down cleanly: {}", room, e.getMessage());
		}
	}

	/**
	 * Ask the counterpart to leave the room.
	 */
	public CompletableFuture<Void> forceRemovePeer() {
		return loop.submit("kick", () -> {
			if (!state.getPhase().isActive()) {
				log.warn("Cannot remove peer from room {} in state {}", room, state.getPhase());
				return done();
			}
			log.info("Removing peer {} from room {}", state.getCounterpart(), room);
			return sendSignal(SignalKind.KICK, null).thenAccept(sent -> { });
		});
	}

	/**
	 * @return whether local audio is enabled afterwards; false when there is no local audio track
	 */
	public boolean toggleLocalAudio() {
		return toggleLocalTrack(MediaKind.AUDIO);
	}

	/**
	 * @return whether local video is enabled afterwards; false when there is no local video track
	 */
	public boolean toggleLocalVideo() {
		return toggleLocalTrack(MediaKind.VIDEO);
	}

	public SessionState getPhase() {
		return state.getPhase();
	}

	/**
	 * Remote stream, present only while the session is connected
	 */
	public Optional<MediaHandle> getRemoteMedia() {
		return Optional.ofNullable(exposedRemoteMedia);
	}

	public CompletableFuture<NegotiationSnapshot> snapshot() {
		return loop.submit("snapshot", () -> CompletableFuture.completedFuture(new NegotiationSnapshot(
				state.getPhase(),
				state.getRole(),
				state.getCounterpart(),
				state.getCandidateQueue().size(),
				state.isRemoteDescriptionSet(),
				state.getProcessedJoins().size(),
				state.getTransportGeneration())));
	}

	public CompletableFuture<Void> terminated() {
		return terminated;
	}

	// ---------------------------------------------------------------- room lifecycle

	private CompletableFuture<Void> joinRoom() {
		SessionState phase = state.getPhase();
		if (tearingDown.get()) {
			log.debug("Session for room {} is shutting down, not joining", room);
			return done();
		}
		if (phase != SessionState.IDLE && phase != SessionState.FAILED) {
			log.debug("Ignoring start in state {}", phase);
			return done();
		}
		log.info("Joining room {} as {}", room, self);
		return relay.connect(room).handle((ignored, ex) -> {
			if (tearingDown.get()) {
				log.info("Connect to room {} abandoned, session is shutting down", room);
				return null;
			}
			if (ex != null) {
				Throwable cause = SignalingException.unwrap(ex);
				log.error("Failed to connect to signaling service for room {}: {}", room, cause.getMessage());
				state.setPhase(SessionState.FAILED);
				updateStatus(status.withConnecting(false).withError("Failed to connect to signaling service"));
				throw new CompletionException(cause);
			}
			enterAwaitingCounterpart();
			return null;
		});
	}

	private void enterAwaitingCounterpart() {
		openTransport();
		state.setPhase(SessionState.AWAITING_COUNTERPART);
		log.info("Waiting for a counterpart in room {}", room);
		startPresence();
	}

	private void startPresence() {
		long generation = state.getTransportGeneration();
		PresenceAnnouncer announcer = new PresenceAnnouncer(scheduler, settings.getPresenceInterval(),
				settings.getPresenceRetries(),
				() -> loop.submit("presence", () -> announcePresence(generation)),
				() -> loop.submit("presence-exhausted", () -> presenceExhausted(generation)));
		state.setPresenceAnnouncer(announcer);
		announcer.start();
	}

	private CompletableFuture<Void> announcePresence(long generation) {
		if (state.getPhase() != SessionState.AWAITING_COUNTERPART || generation != state.getTransportGeneration()) {
			return done();
		}
		return sendSignal(SignalKind.JOIN, null).thenAccept(sent -> { });
	}

	private CompletableFuture<Void> presenceExhausted(long generation) {
		if (state.getPhase() == SessionState.AWAITING_COUNTERPART && generation == state.getTransportGeneration()) {
			log.info("No counterpart answered {} join announcement(s) in room {}, still waiting",
					settings.getPresenceRetries() + 1, room);
			updateStatus(status.withConnecting(false));
		}
		return done();
	}

	private void cancelPresence() {
		PresenceAnnouncer announcer = state.getPresenceAnnouncer();
		if (announcer != null) {
			announcer.cancel();
		}
	}

	/**
	 * Drop the current counterpart and transport and wait for the next counterpart with a fresh transport.
	 */
	private void resetSession(String reason, boolean forgetRoomJoins) {
		cancelPresence();
		PeerIdentity previous = state.getCounterpart();
		discardTransport();
		if (forgetRoomJoins) {
			state.getProcessedJoins().forgetRoom(room);
		} else if (previous != null) {
			state.getProcessedJoins().forget(previous, room);
		}
		state.clearCounterpart();
		clearRemoteMedia();
		updateStatus(SessionStatus.interrupted(reason));
		enterAwaitingCounterpart();
	}

	private CompletableFuture<Void> releaseResources(boolean announceLeave) {
		if (state.getPhase() != SessionState.REMOVED) {
			state.setPhase(SessionState.CLOSED);
		}
		try {
			cancelPresence();
		} catch (RuntimeException e) {
			log.warn("Failed to cancel presence announcements: {}", e.getMessage(), e);
		}

		CompletableFuture<Boolean> leave = CompletableFuture.completedFuture(false);
		if (announceLeave && relay.isConnected()) {
			leave = sendSignal(SignalKind.LEAVE, null)
					.completeOnTimeout(false, settings.getLeaveGrace().toMillis(), TimeUnit.MILLISECONDS);
		}

		return leave
				.handle((sent, ex) -> (Void) null)
				.thenCompose(ignored -> {
					try {
						discardTransport();
						clearRemoteMedia();
					} catch (RuntimeException e) {
						log.warn("Failed to release session transport: {}", e.getMessage(), e);
					} finally {
						removeRegistrations();
					}
					return relay.disconnect();
				})
				.handle((ignored, ex) -> {
					if (ex != null) {
						log.warn("Failed to release relay subscription for room {}: {}", room,
								SignalingException.unwrap(ex).getMessage());
					}
					log.info("Left room {}", room);
					return null;
				});
	}

	private void finishTermination() {
		loop.close();
		try {
			scheduler.shutdown();
		} catch (RuntimeException e) {
			log.warn("Failed to stop scheduler for room {}: {}", room, e.getMessage());
		} finally {
			terminated.complete(null);
		}
	}

	private synchronized void removeRegistrations() {
		if (messageRegistration != null) {
			messageRegistration.remove();
			messageRegistration = null;
		}
		if (mediaRegistration != null) {
			mediaRegistration.remove();
			mediaRegistration = null;
		}
	}

	// ---------------------------------------------------------------- relay messages

	private void enqueueMessage(SignalMessage message) {
		loop.submit("signal:" + message.getKind(), () -> handleMessage(message));
	}

	private CompletableFuture<Void> handleMessage(SignalMessage message) {
		if (!state.getPhase().isActive()) {
			log.debug("Ignoring {} in state {}", message, state.getPhase());
			return done();
		}
		if (message.getKind() == null || !room.getValue().equals(message.getRoomId())) {
			log.debug("Ignoring message not meant for room {}: {}", room, message);
			return done();
		}
		String senderId = message.getSenderId();
		if (senderId == null || senderId.isBlank() || self.getValue().equals(senderId)) {
			log.debug("Ignoring {} without a foreign sender", message.getKind());
			return done();
		}

		PeerIdentity sender = PeerIdentity.of(senderId);
		return switch (message.getKind()) {
			case JOIN -> onJoin(sender);
			case OFFER -> onOffer(sender, message);
			case ANSWER -> onAnswer(sender, message);
			case ICE_CANDIDATE -> onIceCandidate(sender, message);
			case LEAVE -> onLeave(sender);
			case KICK -> onKick(sender);
		};
	}

	private CompletableFuture<Void> onJoin(PeerIdentity sender) {
		if (state.getPhase() != SessionState.AWAITING_COUNTERPART) {
			log.debug("Ignoring join from {} in state {}", sender, state.getPhase());
			return done();
		}
		if (!state.getProcessedJoins().markProcessed(sender, room)) {
			log.debug("Ignoring duplicate join from {}", sender);
			return done();
		}

		NegotiationRole role = RoleResolver.resolve(self, sender);
		SessionTransport transport = beginNegotiation(sender, role);
		if (transport == null) {
			return done();
		}

		if (role == NegotiationRole.FOLLOWER) {
			log.info("Peer {} joined room {}, waiting for their offer", sender, room);
			// Answer the announcement so a leader that subscribed after our own joins still learns about us
			return sendSignal(SignalKind.JOIN, null).thenAccept(sent -> { });
		}

		log.info("Peer {} joined room {}, creating offer", sender, room);
		return localMedia.awaitReady(settings.getMediaWaitTimeout())
				.thenCompose(media -> {
					if (media.isPresent()) {
						bindMedia(transport, media.get());
					} else {
						log.warn("Local media not ready, creating offer without media tracks");
					}
					return createAndSendOffer(transport);
				});
	}

	private CompletableFuture<Void> onOffer(PeerIdentity sender, SignalMessage message) {
		Optional<SessionDescription> offer = codec.decode(message.getPayload(), SessionDescription.class);
		if (offer.isEmpty()) {
			log.warn("Ignoring offer without session description from {}", sender);
			return done();
		}
		PeerIdentity counterpart = state.getCounterpart();
		if (counterpart != null && !counterpart.equals(sender)) {
			log.warn("Ignoring offer from {} while negotiating with {}", sender, counterpart);
			return done();
		}

		SessionTransport transport;
		if (counterpart == null) {
			state.getProcessedJoins().markProcessed(sender, room);
			transport = beginNegotiation(sender, RoleResolver.resolve(self, sender));
		} else {
			if (state.getPhase() != SessionState.CONNECTED) {
				state.setPhase(SessionState.NEGOTIATING);
				updateStatus(status.withConnecting(true).withError(null));
			}
			transport = requireTransport();
		}
		if (transport == null) {
			return done();
		}

		log.info("Received offer from {}", sender);
		return done()
				.thenCompose(ignored -> {
					if (transport.signalingState() != SignalingState.STABLE) {
						log.info("Glare detected (signaling state {}), rolling back local offer",
								transport.signalingState());
						return bounded("rollback", transport.rollback());
					}
					return done();
				})
				.thenCompose(ignored -> bounded("setRemoteDescription", transport.setRemoteDescription(offer.get())))
				.thenCompose(ignored -> {
					state.setRemoteDescriptionSet(true);
					return state.getCandidateQueue().drainInto(transport);
				})
				.thenCompose(applied -> bounded("createAnswer", transport.createAnswer()))
				.thenCompose(answer -> bounded("setLocalDescription", transport.setLocalDescription(answer))
						.thenApply(ignored -> answer))
				.handle((answer, ex) -> {
					if (ex != null) {
						reportNegotiationFailure("Failed to answer offer", ex);
						return null;
					}
					return answer;
				})
				.thenCompose(answer -> answer == null
						? done()
						: sendSignal(SignalKind.ANSWER, answer).thenAccept(sent -> {
							if (sent) {
								log.info("Answer sent to {}", sender);
							}
						}));
	}

	private CompletableFuture<Void> onAnswer(PeerIdentity sender, SignalMessage message) {
		Optional<SessionDescription> answer = codec.decode(message.getPayload(), SessionDescription.class);
		if (answer.isEmpty()) {
			log.warn("Ignoring answer without session description from {}", sender);
			return done();
		}
		if (!sender.equals(state.getCounterpart())) {
			log.warn("Ignoring answer from {}, counterpart is {}", sender, state.getCounterpart());
			return done();
		}
		SessionTransport transport = state.getTransport();
		if (transport == null || transport.signalingState() != SignalingState.HAVE_LOCAL_OFFER) {
			log.warn("Ignoring answer from {} in signaling state {}", sender,
					transport != null ? transport.signalingState() : null);
			return done();
		}

		log.info("Received answer from {}", sender);
		return done()
				.thenCompose(ignored -> bounded("setRemoteDescription", transport.setRemoteDescription(answer.get())))
				.thenCompose(ignored -> {
					state.setRemoteDescriptionSet(true);
					return state.getCandidateQueue().drainInto(transport);
				})
				.handle((applied, ex) -> {
					if (ex != null) {
						reportNegotiationFailure("Failed to apply answer", ex);
					} else if (applied > 0) {
						log.debug("Applied {} queued ICE candidate(s) after answer", applied);
					}
					return null;
				});
	}

	private CompletableFuture<Void> onIceCandidate(PeerIdentity sender, SignalMessage message) {
		Optional<IceCandidate> candidate = codec.decode(message.getPayload(), IceCandidate.class);
		if (candidate.isEmpty()) {
			return done();
		}
		PeerIdentity counterpart = state.getCounterpart();
		if (counterpart != null && !counterpart.equals(sender)) {
			log.debug("Ignoring ICE candidate from {}, counterpart is {}", sender, counterpart);
			return done();
		}
		SessionTransport transport = state.getTransport();
		if (!state.isRemoteDescriptionSet() || transport == null) {
			state.getCandidateQueue().enqueue(sender, candidate.get());
			return done();
		}
		return done()
				.thenCompose(ignored -> bounded("addIceCandidate", transport.addIceCandidate(candidate.get())))
				.handle((ignored, ex) -> {
					if (ex != null) {
						log.warn("Failed to add ICE candidate {}: {}", candidate.get().getCandidate(),
								SignalingException.unwrap(ex).getMessage());
					}
					return null;
				});
	}

	private CompletableFuture<Void> onLeave(PeerIdentity sender) {
		PeerIdentity counterpart = state.getCounterpart();
		if (!sender.equals(counterpart)) {
			log.debug("Ignoring leave from {}, counterpart is {}", sender, counterpart);
			return done();
		}
		log.info("Peer {} left room {}", sender, room);
		resetSession("Peer disconnected", true);
		return done();
	}

	private CompletableFuture<Void> onKick(PeerIdentity sender) {
		if (!sender.equals(state.getCounterpart())) {
			log.warn("Ignoring kick from {}, counterpart is {}", sender, state.getCounterpart());
			return done();
		}
		if (!tearingDown.compareAndSet(false, true)) {
			return done();
		}
		log.info("Removed from room {} by {}", room, sender);
		state.setPhase(SessionState.REMOVED);
		updateStatus(SessionStatus.idle());
		notifyObserver(SessionObserver::onRemoved);
		return releaseResources(true).whenComplete((ignored, ex) -> finishTermination());
	}

	// ---------------------------------------------------------------- negotiation steps

	private SessionTransport beginNegotiation(PeerIdentity counterpart, NegotiationRole role) {
		cancelPresence();
		state.setCounterpart(counterpart);
		state.setRole(role);
		// Candidates queued while there was no counterpart may come from anyone in the room
		state.getCandidateQueue().retainFrom(counterpart);
		state.setPhase(SessionState.NEGOTIATING);
		log.info("Negotiating with {} as {}", counterpart, role);
		updateStatus(SessionStatus.connecting());
		return requireTransport();
	}

	private CompletableFuture<Void> createAndSendOffer(SessionTransport transport) {
		return done()
				.thenCompose(ignored -> {
					if (transport.signalingState() != SignalingState.STABLE) {
						log.info("Signaling state {} before offer, rolling back", transport.signalingState());
						return bounded("rollback", transport.rollback());
					}
					return done();
				})
				.thenCompose(ignored -> bounded("createOffer", transport.createOffer()))
				.thenCompose(offer -> bounded("setLocalDescription", transport.setLocalDescription(offer))
						.thenApply(ignored -> offer))
				.handle((offer, ex) -> {
					if (ex != null) {
						reportNegotiationFailure("Failed to create offer", ex);
						return null;
					}
					return offer;
				})
				.thenCompose(offer -> offer == null
						? done()
						: sendSignal(SignalKind.OFFER, offer).thenAccept(sent -> {
							if (sent) {
								log.info("Offer sent to {}", state.getCounterpart());
							}
						}));
	}

	private SessionTransport requireTransport() {
		if (state.getTransport() == null) {
			openTransport();
		}
		return state.getTransport();
	}

	private void openTransport() {
		long generation = state.nextTransportGeneration();
		state.getCandidateQueue().clear();
		state.setRemoteDescriptionSet(false);
		SessionTransport transport;
		try {
			transport = transportFactory.create(transportConfiguration, new TransportEvents(generation));
		} catch (RuntimeException e) {
			state.setTransport(null);
			reportNegotiationFailure("Failed to create session transport", e);
			return;
		}
		state.setTransport(transport);
		log.debug("Created session transport #{} for room {}", generation, room);
		localMedia.current().ifPresent(media -> bindMedia(transport, media));
	}

	private void discardTransport() {
		SessionTransport transport = state.getTransport();
		state.setTransport(null);
		state.getCandidateQueue().clear();
		state.setRemoteDescriptionSet(false);
		if (transport == null) {
			return;
		}
		try {
			transport.close();
			log.debug("Closed session transport #{}", state.getTransportGeneration());
		} catch (RuntimeException e) {
			log.warn("Error closing session transport: {}", e.getMessage(), e);
		}
	}

	private void bindMedia(SessionTransport transport, MediaHandle media) {
		try {
			transport.bindLocalMedia(media);
			log.debug("Bound {} local track(s) to session transport", media.getTracks().size());
		} catch (RuntimeException e) {
			log.warn("Failed to bind local media: {}", e.getMessage(), e);
		}
	}

	// ---------------------------------------------------------------- transport callbacks

	private CompletableFuture<Void> onTransportStateChange(long generation, ConnectionState connectionState) {
		if (!state.isCurrentTransport(generation) || !state.getPhase().isActive()) {
			log.debug("Ignoring {} from discarded transport #{}", connectionState, generation);
			return done();
		}
		log.info("Session transport #{} is {}", generation, connectionState);
		switch (connectionState) {
			case CONNECTING -> updateStatus(status.withConnecting(true));
			case CONNECTED -> {
				cancelPresence();
				exposeRemoteMedia();
				updateStatus(SessionStatus.established());
				state.setPhase(SessionState.CONNECTED);
			}
			case DISCONNECTED, FAILED, CLOSED ->
					resetSession("Connection " + connectionState.name().toLowerCase(Locale.ROOT), false);
			default -> {
			}
		}
		return done();
	}

	private CompletableFuture<Void> onLocalCandidate(long generation, IceCandidate candidate) {
		if (!state.isCurrentTransport(generation) || !state.getPhase().isActive()) {
			return done();
		}
		return sendSignal(SignalKind.ICE_CANDIDATE, candidate).thenAccept(sent -> { });
	}

	private CompletableFuture<Void> onRemoteMedia(long generation, MediaHandle media) {
		if (!state.isCurrentTransport(generation)) {
			return done();
		}
		state.setRemoteMedia(media);
		if (state.getPhase() == SessionState.CONNECTED) {
			exposeRemoteMedia();
		}
		return done();
	}

	private void exposeRemoteMedia() {
		MediaHandle media = state.getRemoteMedia();
		if (media == null || state.isRemoteMediaExposed()) {
			return;
		}
		state.setRemoteMediaExposed(true);
		exposedRemoteMedia = media;
		notifyObserver(o -> o.onRemoteMedia(media));
	}

	private void clearRemoteMedia() {
		boolean exposed = state.isRemoteMediaExposed();
		state.setRemoteMedia(null);
		state.setRemoteMediaExposed(false);
		exposedRemoteMedia = null;
		if (exposed) {
			notifyObserver(o -> o.onRemoteMedia(null));
		}
	}

	// ---------------------------------------------------------------- helpers

	/**
	 * @return future of whether the relay accepted the message; never completes exceptionally
	 */
	private CompletableFuture<Boolean> sendSignal(SignalKind kind, Object payload) {
		CompletableFuture<Void> sending;
		try {
			sending = relay.send(kind, payload != null ? codec.encode(payload) : null);
		} catch (RuntimeException e) {
			sending = CompletableFuture.failedFuture(e);
		}
		return sending.handle((ignored, ex) -> {
			if (ex != null) {
				log.warn("Failed to send {}: {}", kind.getWireName(), SignalingException.unwrap(ex).getMessage());
				updateStatus(status.withError("Failed to send " + kind.getWireName()));
				return false;
			}
			return true;
		});
	}

	private void reportNegotiationFailure(String message, Throwable failure) {
		Throwable cause = SignalingException.unwrap(failure);
		NegotiationFailedException error = new NegotiationFailedException(message, cause);
		log.error("{}: {}", error.getMessage(), cause.getMessage());
		updateStatus(status.withError(message + ": " + cause.getMessage()));
	}

	private void updateStatus(SessionStatus next) {
		if (next.equals(status)) {
			return;
		}
		status = next;
		notifyObserver(o -> o.onStatusChanged(next));
	}

	private void notifyObserver(Consumer<SessionObserver> notification) {
		try {
			notification.accept(observer);
		} catch (RuntimeException e) {
			log.warn("Session observer failed: {}", e.getMessage(), e);
		}
	}

	private boolean toggleLocalTrack(MediaKind kind) {
		Optional<MediaTrack> track = localMedia.current().flatMap(media -> media.firstTrack(kind));
		if (track.isEmpty()) {
			return false;
		}
		MediaTrack mediaTrack = track.get();
		mediaTrack.setEnabled(!mediaTrack.isEnabled());
		log.debug("Local {} {}", kind.name().toLowerCase(Locale.ROOT), mediaTrack.isEnabled() ? "enabled" : "disabled");
		return mediaTrack.isEnabled();
	}

	/**
	 * Give up on a transport operation that has not settled within the transport timeout, so a stuck
	 * transport cannot hold the event loop and with it the teardown.
	 */
	private <T> CompletableFuture<T> bounded(String operation, CompletableFuture<T> pending) {
		long limit = settings.getTransportTimeout().toMillis();
		return pending.copy()
				.orTimeout(limit, TimeUnit.MILLISECONDS)
				.handle((value, ex) -> {
					if (ex == null) {
						return value;
					}
					Throwable cause = SignalingException.unwrap(ex);
					if (cause instanceof TimeoutException) {
						cause = new TimeoutException(operation + " did not complete within " + limit + " ms");
					}
					throw new CompletionException(cause);
				});
	}

	private static CompletableFuture<Void> done() {
		return CompletableFuture.completedFuture(null);
	}

	private static ThreadPoolTaskScheduler createScheduler(RoomIdentity room) {
		ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
		scheduler.setPoolSize(1);
		scheduler.setThreadNamePrefix("room-" + room.getValue() + "-");
		scheduler.setRemoveOnCancelPolicy(true);
		scheduler.setWaitForTasksToCompleteOnShutdown(true);
		scheduler.initialize();
		return scheduler;
	}

	/**
	 * Routes callbacks of one transport instance into the event loop, tagged with its generation.
	 */
	private final class TransportEvents implements TransportListener {

		private final long generation;

		private TransportEvents(long generation) {
			this.generation = generation;
		}

		@Override
		public void onIceCandidate(IceCandidate candidate) {
			if (candidate != null) {
				loop.submit("local-candidate", () -> onLocalCandidate(generation, candidate));
			}
		}

		@Override
		public void onConnectionStateChange(ConnectionState connectionState) {
			loop.submit("transport-" + connectionState, () -> onTransportStateChange(generation, connectionState));
		}

		@Override
		public void onRemoteMedia(MediaHandle remoteMedia) {
			loop.submit("remote-media", () -> SessionCoordinator.this.onRemoteMedia(generation, remoteMedia));
		}
	}

	private final class LocalMediaBinding implements LocalMedia.Listener {

		@Override
		public void onMediaChanged(MediaHandle media) {
			loop.submit("local-media", () -> {
				SessionTransport transport = state.getTransport();
				if (transport != null) {
					bindMedia(transport, media);
				}
				return done();
			});
		}

		@Override
		public void onMediaUnavailable(MediaUnavailableException failure) {
			loop.submit("local-media-failure", () -> {
				updateStatus(status.withError("Camera/Mic access denied"));
				return done();
			});
		}
	}
}
