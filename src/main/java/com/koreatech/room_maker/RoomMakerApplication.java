package com.koreatech.room_maker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RoomMakerApplication {

	public static void main(String[] args) {
		SpringApplication.run(RoomMakerApplication.class, args);
	}

}
