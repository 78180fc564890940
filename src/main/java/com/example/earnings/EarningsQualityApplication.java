package com.example.earnings;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

@EnableCaching
@SpringBootApplication
public class EarningsQualityApplication {

    public static void main(String[] args) {
        SpringApplication.run(EarningsQualityApplication.class, args);
    }

}
