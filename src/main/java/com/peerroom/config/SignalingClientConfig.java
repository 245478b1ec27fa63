package com.peerroom.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.peerroom.relay.RelayChannelFactory;
import com.peerroom.relay.StompRelayChannelFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.converter.MappingJackson2MessageConverter;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.messaging.WebSocketStompClient;

/**
 * Client side of the relay: the STOMP client every room session publishes and subscribes through.
 */
@Configuration
@Slf4j
public class SignalingClientConfig {

	@Bean
	public WebSocketStompClient signalingStompClient(ObjectMapper objectMapper, PeerRoomProperties properties) {
		WebSocketStompClient stompClient = new WebSocketStompClient(new StandardWebSocketClient());
		MappingJackson2MessageConverter converter = new MappingJackson2MessageConverter();
		converter.setObjectMapper(objectMapper);
		stompClient.setMessageConverter(converter);

		ThreadPoolTaskScheduler heartbeatScheduler = new ThreadPoolTaskScheduler();
		heartbeatScheduler.setPoolSize(1);
		heartbeatScheduler.setThreadNamePrefix("signaling-heartbeat-");
		heartbeatScheduler.setDaemon(true);
		heartbeatScheduler.initialize();
		stompClient.setTaskScheduler(heartbeatScheduler);
		stompClient.setDefaultHeartbeat(new long[]{10000, 10000});
		// Subscription receipts are tracked on the same scheduler
		stompClient.setReceiptTimeLimit(properties.getSubscribeTimeout().toMillis());
		return stompClient;
	}

	@Bean
	public RelayChannelFactory relayChannelFactory(WebSocketStompClient signalingStompClient,
			PeerRoomProperties properties) {
		log.info("Signaling relay endpoint: {}", properties.getRelayUrl());
		return new StompRelayChannelFactory(signalingStompClient, properties.getRelayUrl());
	}
}
