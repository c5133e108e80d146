package com.rms.relay.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.rms.relay")
public class CloudRelayApplication {
    public static void main(String[] args) {
        SpringApplication.run(CloudRelayApplication.class, args);
    }
}
