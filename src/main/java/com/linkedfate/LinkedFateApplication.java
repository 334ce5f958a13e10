package com.linkedfate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LinkedFateApplication {

    public static void main(String[] args) {
        SpringApplication.run(LinkedFateApplication.class, args);
    }
}
