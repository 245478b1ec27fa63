package com.peerroom.metrics;

import com.peerroom.dto.SignalKind;
import com.peerroom.registry.RoomSessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counts relayed signals per kind and logs a summary once a minute, so busy rooms are visible
 * without logging every candidate.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SignalMetricsTracker {

	private final RoomSessionRegistry roomSessionRegistry;

	private final Map<SignalKind, LongAdder> counters = createCounters();
	private final LongAdder dropped = new LongAdder();

	public void record(SignalKind kind) {
		counters.get(kind).increment();
	}

	public void recordDropped() {
		dropped.increment();
	}

	/**
	 * Counts since the previous drain, reset to zero afterwards
	 */
	public Map<SignalKind, Long> drainCounts() {
		Map<SignalKind, Long> counts = new EnumMap<>(SignalKind.class);
		counters.forEach((kind, counter) -> counts.put(kind, counter.sumThenReset()));
		return counts;
	}

	@Scheduled(fixedRate = 60000)
	public void logSignalStats() {
		Map<SignalKind, Long> counts = drainCounts();
		long total = counts.values().stream().mapToLong(Long::longValue).sum();
		long droppedCount = dropped.sumThenReset();
		if (total == 0 && droppedCount == 0) {
			return;
		}
		log.info("Relay signal stats: total={}, byKind={}, dropped={}, activeSessions={}",
				total, counts, droppedCount, roomSessionRegistry.getActiveSessionCount());
	}

	private static Map<SignalKind, LongAdder> createCounters() {
		Map<SignalKind, LongAdder> counters = new EnumMap<>(SignalKind.class);
		for (SignalKind kind : SignalKind.values()) {
			counters.put(kind, new LongAdder());
		}
		return counters;
	}
}
