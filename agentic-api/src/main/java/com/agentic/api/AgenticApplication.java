package com.agentic.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Main application entry point for the Agentic Orchestrator.
 */
@SpringBootApplication
@ComponentScan(basePackages = {
    "com.agentic.api",
    "com.agentic.engine"
})
public class AgenticApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(AgenticApplication.class, args);
    }
}
