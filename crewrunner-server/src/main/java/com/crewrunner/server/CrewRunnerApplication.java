package com.crewrunner.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Main application entry point for the Crew Runner.
 */
@SpringBootApplication
@ComponentScan(basePackages = {
    "com.crewrunner.server",
    "com.crewrunner.engine"
})
public class CrewRunnerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrewRunnerApplication.class, args);
    }
}
