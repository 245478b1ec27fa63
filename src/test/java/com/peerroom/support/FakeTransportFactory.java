package com.peerroom.support;

import com.peerroom.transport.SessionTransportFactory;
import com.peerroom.transport.TransportConfiguration;
import com.peerroom.transport.TransportListener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class FakeTransportFactory implements SessionTransportFactory {

	private final String name;
	private final List<FakeSessionTransport> created = new CopyOnWriteArrayList<>();
	private volatile boolean failCreateOffer;
	private volatile boolean stallCreateOffer;
	private volatile boolean autoConnect = true;
	private volatile TransportConfiguration lastConfiguration;

	public FakeTransportFactory(String name) {
		this.name = name;
	}

	@Override
	public FakeSessionTransport create(TransportConfiguration configuration, TransportListener listener) {
		lastConfiguration = configuration;
		FakeSessionTransport transport = new FakeSessionTransport(name + "#" + (created.size() + 1), listener,
				failCreateOffer, autoConnect);
		transport.setStallCreateOffer(stallCreateOffer);
		created.add(transport);
		return transport;
	}

	public void setFailCreateOffer(boolean failCreateOffer) {
		this.failCreateOffer = failCreateOffer;
	}

	public void setStallCreateOffer(boolean stallCreateOffer) {
		this.stallCreateOffer = stallCreateOffer;
	}

	public void setAutoConnect(boolean autoConnect) {
		this.autoConnect = autoConnect;
	}

	public List<FakeSessionTransport> getCreated() {
		return created;
	}

	public FakeSessionTransport latest() {
		return created.isEmpty() ? null : created.get(created.size() - 1);
	}

	public TransportConfiguration getLastConfiguration() {
		return lastConfiguration;
	}
}
