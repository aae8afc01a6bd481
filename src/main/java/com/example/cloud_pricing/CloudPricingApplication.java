package com.example.cloud_pricing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CloudPricingApplication {
    public static void main(String[] args) {
        SpringApplication.run(CloudPricingApplication.class, args);
    }
}
