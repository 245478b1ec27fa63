package com.peerroom.controller;

import com.peerroom.dto.RoomStatusResponse;
import com.peerroom.model.RoomIdentity;
import com.peerroom.registry.RoomSessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/rooms")
@RequiredArgsConstructor
@Slf4j
public class RoomController {

	private final RoomSessionRegistry roomSessionRegistry;

	@GetMapping("/{roomId}")
	public ResponseEntity<RoomStatusResponse> getRoom(@PathVariable String roomId) {
		RoomIdentity room = RoomIdentity.of(roomId);
		int participants = roomSessionRegistry.participants(room.getValue()).size();
		log.debug("Room {} has {} participant(s)", room, participants);
		return ResponseEntity.ok(new RoomStatusResponse(room.getValue(), participants,
				participants >= RoomSessionRegistry.ROOM_CAPACITY));
	}
}
