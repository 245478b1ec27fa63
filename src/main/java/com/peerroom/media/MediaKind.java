package com.peerroom.media;

public enum MediaKind {
	AUDIO,
	VIDEO
}
