package com.logwatch.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LogAnomalyEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogAnomalyEngineApplication.class, args);
    }
}
