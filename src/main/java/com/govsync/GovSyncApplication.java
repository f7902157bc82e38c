package com.govsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GovSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(GovSyncApplication.class, args);
    }
}
