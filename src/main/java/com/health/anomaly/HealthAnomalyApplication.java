package com.health.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class HealthAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(HealthAnomalyApplication.class, args);
    }
}
