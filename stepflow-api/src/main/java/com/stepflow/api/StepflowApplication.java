package com.stepflow.api;

import com.stepflow.engine.config.StepflowProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application entry point for Stepflow.
 */
@SpringBootApplication(scanBasePackages = "com.stepflow")
@EnableConfigurationProperties(StepflowProperties.class)
@EnableScheduling
public class StepflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(StepflowApplication.class, args);
    }
}
