package com.example.syncroom;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SyncRoomApplication {

    public static void main(String[] args) {
        SpringApplication.run(SyncRoomApplication.class, args);
    }
}
