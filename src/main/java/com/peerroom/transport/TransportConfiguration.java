package com.peerroom.transport;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TransportConfiguration {

	@Singular
	List<IceServer> iceServers;
}
