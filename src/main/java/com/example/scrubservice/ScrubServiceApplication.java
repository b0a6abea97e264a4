package com.example.scrubservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ScrubServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScrubServiceApplication.class, args);
    }
}
