package com.peerroom.negotiation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Re-broadcasts the join announcement: once immediately, then every interval until the retry budget is spent
 * or it is cancelled. A join published before the counterpart subscribed is lost, so the first one alone is
 * not enough.
 *
 * One instance serves one transport lifetime; once cancelled it never announces again.
 */
@Slf4j
public class PresenceAnnouncer {

	private final TaskScheduler scheduler;
	private final Duration interval;
	private final int maxRetries;
	private final Runnable announce;
	private final Runnable onExhausted;

	private final AtomicInteger attempts = new AtomicInteger();
	private volatile ScheduledFuture<?> retries;
	private volatile boolean stopped;

	public PresenceAnnouncer(TaskScheduler scheduler, Duration interval, int maxRetries,
			Runnable announce, Runnable onExhausted) {
		this.scheduler = scheduler;
		this.interval = interval;
		this.maxRetries = maxRetries;
		this.announce = announce;
		this.onExhausted = onExhausted;
	}

	public void start() {
		if (stopped || attempts.get() > 0) {
			return;
		}
		attempts.incrementAndGet();
		announce.run();
		if (maxRetries <= 0) {
			stop();
			return;
		}
		retries = scheduler.scheduleWithFixedDelay(this::retry, Instant.now().plus(interval), interval);
		if (stopped) {
			retries.cancel(false);
		}
	}

	public void cancel() {
		if (!stopped) {
			log.debug("Presence announcement cancelled after {} attempt(s)", attempts.get());
		}
		stop();
	}

	public int getAttempts() {
		return attempts.get();
	}

	public boolean isStopped() {
		return stopped;
	}

	private void retry() {
		if (stopped) {
			return;
		}
		int attempt = attempts.incrementAndGet();
		log.debug("Re-announcing presence (attempt {} of {})", attempt, maxRetries + 1);
		announce.run();
		if (attempt >= maxRetries + 1) {
			stop();
			onExhausted.run();
		}
	}

	private void stop() {
		stopped = true;
		ScheduledFuture<?> scheduled = retries;
		if (scheduled != null) {
			scheduled.cancel(false);
		}
	}
}
