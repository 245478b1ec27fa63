package com.peerroom.negotiation;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class PresenceAnnouncerTest {

	private ThreadPoolTaskScheduler scheduler;
	private final AtomicInteger announcements = new AtomicInteger();
	private final AtomicInteger exhausted = new AtomicInteger();

	@BeforeEach
	void setUp() {
		scheduler = new ThreadPoolTaskScheduler();
		scheduler.setPoolSize(1);
		scheduler.initialize();
	}

	@AfterEach
	void tearDown() {
		scheduler.shutdown();
	}

	@Test
	void announcesOnceThenRetriesUntilBudgetIsSpent() {
		PresenceAnnouncer announcer = new PresenceAnnouncer(scheduler, Duration.ofMillis(30), 3,
				announcements::incrementAndGet, exhausted::incrementAndGet);

		announcer.start();
		assertThat(announcements.get()).isEqualTo(1);

		await().atMost(Duration.ofSeconds(2)).until(() -> exhausted.get() == 1);
		assertThat(announcer.isStopped()).isTrue();
		assertThat(announcements.get()).isEqualTo(4);

		await().during(Duration.ofMillis(150)).atMost(Duration.ofSeconds(1))
				.until(() -> announcements.get() == 4);
	}

	@Test
	void cancelStopsFurtherAnnouncements() {
		PresenceAnnouncer announcer = new PresenceAnnouncer(scheduler, Duration.ofMillis(30), 100,
				announcements::incrementAndGet, exhausted::incrementAndGet);

		announcer.start();
		await().atMost(Duration.ofSeconds(2)).until(() -> announcements.get() >= 2);
		announcer.cancel();
		int afterCancel = announcements.get();

		await().during(Duration.ofMillis(150)).atMost(Duration.ofSeconds(1))
				.until(() -> announcements.get() == afterCancel);
		assertThat(exhausted.get()).isZero();
		assertThat(announcer.isStopped()).isTrue();
	}

	@Test
	void zeroRetriesAnnouncesExactlyOnce() {
		PresenceAnnouncer announcer = new PresenceAnnouncer(scheduler, Duration.ofMillis(30), 0,
				announcements::incrementAndGet, exhausted::incrementAndGet);

		announcer.start();

		assertThat(announcer.isStopped()).isTrue();
		await().during(Duration.ofMillis(100)).atMost(Duration.ofSeconds(1))
				.until(() -> announcements.get() == 1);
	}

	@Test
	void cancelledAnnouncerNeverStarts() {
		PresenceAnnouncer announcer = new PresenceAnnouncer(scheduler, Duration.ofMillis(30), 3,
				announcements::incrementAndGet, exhausted::incrementAndGet);

		announcer.cancel();
		announcer.start();

		assertThat(announcements.get()).isZero();
	}
}
