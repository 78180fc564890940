package com.example.earnings.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DecompositionConfig {

    @Bean
    public AttributionSettings attributionSettings(@Value("${decomposition.floor:50}") double floor,
                                                   @Value("${decomposition.cap:500}") double cap,
                                                   @Value("${decomposition.tolerance:1e-6}") double tolerance) {
        return new AttributionSettings(floor, cap, tolerance);
    }
}
