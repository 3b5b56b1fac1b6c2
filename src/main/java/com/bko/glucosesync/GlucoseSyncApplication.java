package com.bko.glucosesync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GlucoseSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(GlucoseSyncApplication.class, args);
    }
}
