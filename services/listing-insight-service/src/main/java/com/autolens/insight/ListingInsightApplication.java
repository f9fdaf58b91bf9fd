package com.autolens.insight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ListingInsightApplication {
    public static void main(String[] args) {
        SpringApplication.run(ListingInsightApplication.class, args);
    }
}
