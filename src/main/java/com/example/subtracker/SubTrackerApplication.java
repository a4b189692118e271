package com.example.subtracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SubTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SubTrackerApplication.class, args);
    }
}
