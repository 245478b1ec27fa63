package com.peerroom.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.peerroom.handler.SubscriptionReceiptInterceptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.Message;
import org.springframework.messaging.converter.DefaultContentTypeResolver;
import org.springframework.messaging.converter.MappingJackson2MessageConverter;
import org.springframework.messaging.converter.MessageConverter;
import org.springframework.messaging.converter.StringMessageConverter;
import org.springframework.messaging.simp.config.ChannelRegistration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.util.MimeTypeUtils;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketTransportRegistration;
import org.springframework.web.socket.messaging.StompSubProtocolErrorHandler;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * STOMP relay broker. Room topics live under {@code /topic/room}, clients publish under {@code /app}.
 */
@Configuration
@EnableWebSocketMessageBroker
@RequiredArgsConstructor
@Slf4j
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

	private static final int MESSAGE_SIZE_LIMIT = 64 * 1024;

	private final SubscriptionReceiptInterceptor subscriptionReceiptInterceptor;

	@Override
	public void configureMessageBroker(MessageBrokerRegistry config) {
		// Heartbeats need a scheduler; created here rather than as a bean to avoid a circular dependency
		config.enableSimpleBroker("/topic")
				.setHeartbeatValue(new long[]{10000, 10000})
				.setTaskScheduler(createHeartbeatScheduler());
		config.setApplicationDestinationPrefixes("/app");
		// Signals of one room must reach subscribers in the order they were published
		config.setPreservePublishOrder(true);
	}

	@Override
	public void registerStompEndpoints(StompEndpointRegistry registry) {
		registry.addEndpoint("/ws")
				.setAllowedOriginPatterns("*");
		registry.addEndpoint("/sockjs")
				.setAllowedOriginPatterns("*")
				.withSockJS()
				.setHeartbeatTime(20000)
				.setDisconnectDelay(3000);
		registry.setPreserveReceiveOrder(true);
		registry.setErrorHandler(stompErrorHandler());
	}

	@Override
	public void configureClientInboundChannel(ChannelRegistration registration) {
		registration.interceptors(subscriptionReceiptInterceptor);
	}

	@Override
	public boolean configureMessageConverters(List<MessageConverter> messageConverters) {
		messageConverters.add(new StringMessageConverter(StandardCharsets.UTF_8));
		messageConverters.add(signalMessageConverter());
		return false;
	}

	@Bean
	public MappingJackson2MessageConverter signalMessageConverter() {
		MappingJackson2MessageConverter converter = new MappingJackson2MessageConverter();
		converter.setObjectMapper(new ObjectMapper());

		DefaultContentTypeResolver resolver = new DefaultContentTypeResolver();
		resolver.setDefaultMimeType(MimeTypeUtils.APPLICATION_JSON);
		converter.setContentTypeResolver(resolver);
		return converter;
	}

	@Override
	public void configureWebSocketTransport(WebSocketTransportRegistration registry) {
		// Session descriptions are the largest frames, a few KB each
		registry.setSendTimeLimit(15 * 1000)
				.setSendBufferSizeLimit(MESSAGE_SIZE_LIMIT * 4)
				.setMessageSizeLimit(MESSAGE_SIZE_LIMIT)
				.setTimeToFirstMessage(30 * 1000);
		log.info("WebSocket transport configured: messageSizeLimit={}KB, sendTimeLimit=15s", MESSAGE_SIZE_LIMIT / 1024);
	}

	@Bean
	public StompSubProtocolErrorHandler stompErrorHandler() {
		return new StompSubProtocolErrorHandler() {
			@Override
			public Message<byte[]> handleClientMessageProcessingError(Message<byte[]> clientMessage, Throwable ex) {
				String sessionId = clientMessage != null
						? (String) clientMessage.getHeaders().get("simpSessionId")
						: "unknown";
				log.warn("STOMP client message processing error (session={}): {}", sessionId, ex.getMessage());
				return super.handleClientMessageProcessingError(clientMessage, ex);
			}
		};
	}

	@Bean
	public ServletServerContainerFactoryBean createWebSocketContainer() {
		ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
		container.setMaxTextMessageBufferSize(MESSAGE_SIZE_LIMIT);
		container.setMaxBinaryMessageBufferSize(MESSAGE_SIZE_LIMIT);
		container.setMaxSessionIdleTimeout(60_000L);
		container.setAsyncSendTimeout(20_000L);
		return container;
	}

	private TaskScheduler createHeartbeatScheduler() {
		ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
		scheduler.setPoolSize(2);
		scheduler.setThreadNamePrefix("ws-heartbeat-");
		scheduler.setAwaitTerminationSeconds(10);
		scheduler.setWaitForTasksToCompleteOnShutdown(true);
		scheduler.initialize();
		return scheduler;
	}
}
