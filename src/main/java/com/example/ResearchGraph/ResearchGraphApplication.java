package com.example.ResearchGraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ResearchGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResearchGraphApplication.class, args);
    }
}
