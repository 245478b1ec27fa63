package com.peerroom.media;

import java.util.List;
import java.util.Optional;

/**
 * A stream of tracks, local or remote.
 */
public interface MediaHandle {

	List<MediaTrack> getTracks();

	default Optional<MediaTrack> firstTrack(MediaKind kind) {
		return getTracks().stream()
				.filter(track -> track.getKind() == kind)
				.findFirst();
	}
}
