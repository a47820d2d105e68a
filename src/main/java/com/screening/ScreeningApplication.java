package com.screening;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Watchlist screening service.
 *
 * Screens identities against sanctions, PEP and deregistered-taxpayer lists,
 * keeps a disposition per onboarded subject, rescreens all subjects nightly
 * and publishes an alert to Kafka whenever a subject becomes rejected or hits
 * a hard-block list.
 *
 * Flow:
 * REST API -> ScreeningEngine -> Database (disposition + outbox) -> Outbox Publisher -> Kafka
 */
@SpringBootApplication
@EnableScheduling  // Rescreen batch and outbox publisher
public class ScreeningApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScreeningApplication.class, args);
    }
}
