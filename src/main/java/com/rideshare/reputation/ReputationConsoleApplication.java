package com.rideshare.reputation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReputationConsoleApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReputationConsoleApplication.class, args);
    }
}
