package com.peerroom.transport;

@FunctionalInterface
public interface SessionTransportFactory {

	SessionTransport create(TransportConfiguration configuration, TransportListener listener);
}
