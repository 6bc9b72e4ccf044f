package com.naag.docsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class NaagDocSyncServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(NaagDocSyncServiceApplication.class, args);
    }
}
