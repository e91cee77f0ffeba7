package com.example.research_insights_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ResearchInsightsBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResearchInsightsBackendApplication.class, args);
    }
}
