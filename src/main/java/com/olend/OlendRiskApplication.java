package com.olend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OlendRiskApplication {

    public static void main(String[] args) {
        SpringApplication.run(OlendRiskApplication.class, args);
    }
}
