package com.reims.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AnomalyEnsembleApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnomalyEnsembleApplication.class, args);
    }
}
