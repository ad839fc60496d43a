package com.servicetracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ServiceTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ServiceTrackerApplication.class, args);
    }
}
