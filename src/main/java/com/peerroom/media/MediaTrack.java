package com.peerroom.media;

public interface MediaTrack {

	MediaKind getKind();

	boolean isEnabled();

	void setEnabled(boolean enabled);
}
