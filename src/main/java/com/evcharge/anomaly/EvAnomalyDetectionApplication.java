package com.evcharge.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EvAnomalyDetectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(EvAnomalyDetectionApplication.class, args);
    }
}
