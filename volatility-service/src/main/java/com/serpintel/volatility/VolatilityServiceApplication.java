package com.serpintel.volatility;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VolatilityServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(VolatilityServiceApplication.class, args);
    }
}
