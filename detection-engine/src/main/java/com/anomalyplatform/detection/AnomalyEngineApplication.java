package com.anomalyplatform.detection;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AnomalyEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnomalyEngineApplication.class, args);
    }
}
