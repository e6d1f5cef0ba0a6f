package com.example.icc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class IccServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(IccServiceApplication.class, args);
    }
}
