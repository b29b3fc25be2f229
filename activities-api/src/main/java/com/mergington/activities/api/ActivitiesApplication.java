package com.mergington.activities.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Main application entry point for the Mergington activities service.
 */
@SpringBootApplication
@ComponentScan(basePackages = {
    "com.mergington.activities.api",
    "com.mergington.activities.engine"
})
public class ActivitiesApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(ActivitiesApplication.class, args);
    }
}
