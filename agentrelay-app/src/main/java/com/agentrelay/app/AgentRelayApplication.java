package com.agentrelay.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Agent Relay application entry point.
 */
@SpringBootApplication
@ComponentScan(basePackages = "com.agentrelay")
public class AgentRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentRelayApplication.class, args);
    }
}
