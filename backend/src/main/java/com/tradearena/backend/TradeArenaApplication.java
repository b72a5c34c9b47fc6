package com.tradearena.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TradeArenaApplication {
    public static void main(String[] args) {
        SpringApplication.run(TradeArenaApplication.class, args);
    }
}
