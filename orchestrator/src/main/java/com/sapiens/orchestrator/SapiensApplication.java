package com.sapiens.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Sapiens journey orchestrator.
 *
 * To run:
 *   ANTHROPIC_API_KEY=sk-ant-... mvn spring-boot:run
 */
@SpringBootApplication
public class SapiensApplication {

    public static void main(String[] args) {
        SpringApplication.run(SapiensApplication.class, args);
    }
}
