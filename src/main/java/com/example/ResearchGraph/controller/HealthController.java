package com.example.ResearchGraph.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    private final String appName;

    public HealthController(@Value("${spring.application.name:ResearchGraph}") String appName) {
        this.appName = appName;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "healthy", "app", appName);
    }
}
