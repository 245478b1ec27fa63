package com.peerroom.handler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Lazy;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessageHandler;
import org.springframework.messaging.simp.broker.AbstractBrokerMessageHandler;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ExecutorChannelInterceptor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.stereotype.Component;

/**
 * Answers a SUBSCRIBE carrying a receipt header with a RECEIPT frame once the broker has registered the
 * subscription. The simple broker never sends receipts itself, and clients rely on them to know that
 * nothing published to the room from then on is missed.
 */
@Component
@Slf4j
public class SubscriptionReceiptInterceptor implements ExecutorChannelInterceptor {

	private static final byte[] EMPTY_PAYLOAD = new byte[0];

	private final MessageChannel clientOutboundChannel;

	public SubscriptionReceiptInterceptor(@Lazy @Qualifier("clientOutboundChannel") MessageChannel clientOutboundChannel) {
		this.clientOutboundChannel = clientOutboundChannel;
	}

	@Override
	public void afterMessageHandled(Message<?> message, MessageChannel channel, MessageHandler handler, Exception ex) {
		if (ex != null || !(handler instanceof AbstractBrokerMessageHandler)) {
			return;
		}
		StompHeaderAccessor accessor = StompHeaderAccessor.wrap(message);
		String receipt = accessor.getReceipt();
		if (!StompCommand.SUBSCRIBE.equals(accessor.getCommand()) || receipt == null) {
			return;
		}

		StompHeaderAccessor receiptAccessor = StompHeaderAccessor.create(StompCommand.RECEIPT);
		receiptAccessor.setReceiptId(receipt);
		receiptAccessor.setSessionId(accessor.getSessionId());
		clientOutboundChannel.send(MessageBuilder.createMessage(EMPTY_PAYLOAD, receiptAccessor.getMessageHeaders()));
		log.debug("Acknowledged subscription to {} for session {}", accessor.getDestination(), accessor.getSessionId());
	}
}
