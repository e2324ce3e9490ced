package com.example.syncroom.store;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class InMemoryStoreConfig {

    @Bean
    public RoomRegistry roomRegistry() {
        return new RoomRegistry();
    }
}
