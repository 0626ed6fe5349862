package com.mevshield.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DetectionEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(DetectionEngineApplication.class, args);
    }
}
