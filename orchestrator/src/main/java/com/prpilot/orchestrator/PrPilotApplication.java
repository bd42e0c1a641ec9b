package com.prpilot.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PrPilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(PrPilotApplication.class, args);
    }
}
