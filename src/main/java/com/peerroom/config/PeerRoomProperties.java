package com.peerroom.config;

import com.peerroom.negotiation.NegotiationSettings;
import com.peerroom.transport.IceServer;
import com.peerroom.transport.TransportConfiguration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings under {@code peerroom.*} in application.yml
 */
@Data
@ConfigurationProperties(prefix = "peerroom")
public class PeerRoomProperties {

	/**
	 * STOMP endpoint of the relay service
	 */
	private String relayUrl = "ws://localhost:8080/ws";

	private Duration subscribeTimeout = Duration.ofSeconds(10);

	private Duration disconnectGrace = Duration.ofSeconds(1);

	private Duration presenceInterval = Duration.ofSeconds(2);

	private int presenceRetries = 5;

	private Duration mediaWaitTimeout = Duration.ofSeconds(3);

	private Duration leaveGrace = Duration.ofSeconds(1);

	/**
	 * Longest a single offer, answer, description or candidate operation may take
	 */
	private Duration transportTimeout = Duration.ofSeconds(10);

	private List<IceServerProperties> iceServers = new ArrayList<>(List.of(
			IceServerProperties.stun("stun:stun.l.google.com:19302"),
			IceServerProperties.stun("stun:global.stun.twilio.com:3478"),
			IceServerProperties.stun("stun:stun1.l.google.com:19302"),
			IceServerProperties.stun("stun:stun2.l.google.com:19302")));

	public NegotiationSettings toNegotiationSettings() {
		return NegotiationSettings.builder()
				.presenceInterval(presenceInterval)
				.presenceRetries(presenceRetries)
				.mediaWaitTimeout(mediaWaitTimeout)
				.leaveGrace(leaveGrace)
				.transportTimeout(transportTimeout)
				.build();
	}

	public TransportConfiguration toTransportConfiguration() {
		TransportConfiguration.TransportConfigurationBuilder builder = TransportConfiguration.builder();
		for (IceServerProperties server : iceServers) {
			builder.iceServer(IceServer.builder()
					.urls(server.getUrls())
					.username(server.getUsername())
					.credential(server.getCredential())
					.build());
		}
		return builder.build();
	}

	@Data
	public static class IceServerProperties {

		private List<String> urls = new ArrayList<>();

		private String username;

		private String credential;

		static IceServerProperties stun(String url) {
			IceServerProperties server = new IceServerProperties();
			server.getUrls().add(url);
			return server;
		}
	}
}
