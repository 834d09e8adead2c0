package com.portfolio.analytics.pulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PortfolioPulseApplication {

    public static void main(String[] args) {
        SpringApplication.run(PortfolioPulseApplication.class, args);
    }
}
