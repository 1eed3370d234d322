package com.signalsync.cloud;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SignalSyncCloudApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignalSyncCloudApplication.class, args);
    }
}
