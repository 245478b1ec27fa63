package com.peerroom;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling // signal metrics summary
@ConfigurationPropertiesScan
public class PeerRoomApplication {

	public static void main(String[] args) {
		SpringApplication.run(PeerRoomApplication.class, args);
	}

}
