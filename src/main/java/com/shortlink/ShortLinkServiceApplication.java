package com.shortlink;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling // Drives the periodic visit reconciliation pass
@EnableAsync // Per-visit log writes
public class ShortLinkServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShortLinkServiceApplication.class, args);
    }

}
