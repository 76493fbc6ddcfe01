package com.ads.signaldetection;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Signal detection pipeline: ingests telemetry from configured sources, detects statistical
 * anomalies over sliding windows and forwards them to the memory system.
 */
@Slf4j
@SpringBootApplication
public class SignalDetectionApplication {

    public static void main(String[] args) {
        log.info("Starting Signal Detection Pipeline...");
        SpringApplication.run(SignalDetectionApplication.class, args);
        log.info("Signal Detection Pipeline started successfully");
    }
}
