package com.diplomacy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Main entry point for the Diplomacy rules engine.
 *
 * Features:
 * - Simultaneous order adjudication with supports and convoys
 * - Retreat and build phases on a configurable cadence
 * - Ready barrier with a phase deadline
 * - Draw votes, press messages and a JSON phase log
 */
@SpringBootApplication
@EnableAsync
public class DiplomacyApplication {

    public static void main(String[] args) {
        SpringApplication.run(DiplomacyApplication.class, args);
    }
}
