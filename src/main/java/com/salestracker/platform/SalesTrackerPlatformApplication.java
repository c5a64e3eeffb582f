package com.salestracker.platform;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SalesTrackerPlatformApplication {

    public static void main(String[] args) {
        SpringApplication.run(SalesTrackerPlatformApplication.class, args);
    }
}
