package com.example.pricing_import;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PricingImportApplication {
    public static void main(String[] args) {
        SpringApplication.run(PricingImportApplication.class, args);
    }
}
