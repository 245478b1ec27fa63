package com.peerroom.relay;

import com.peerroom.model.PeerIdentity;
import com.peerroom.model.RoomIdentity;

@FunctionalInterface
public interface RelayChannelFactory {

	RelayChannel open(RoomIdentity room, PeerIdentity self);
}
