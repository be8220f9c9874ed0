package com.adaptivetrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AdaptiveTraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdaptiveTraderApplication.class, args);
    }
}
