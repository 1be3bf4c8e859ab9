package com.scoutiq.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.scoutiq")
public class ScoutiqApplication {
    public static void main(String[] args) {
        SpringApplication.run(ScoutiqApplication.class, args);
    }
}
