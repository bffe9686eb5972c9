package com.parichay.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Parichay Chat API Application
 *
 * Context-bound chat and moderation engine.
 * Java 17 + Spring Boot 3.2.x
 */
@SpringBootApplication(scanBasePackages = "com.parichay")
@EntityScan(basePackages = "com.parichay.core.domain")
@EnableJpaRepositories(basePackages = "com.parichay.core.repository")
public class ParichayApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(ParichayApiApplication.class, args);
    }
}
