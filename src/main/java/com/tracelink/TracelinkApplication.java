package com.tracelink;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TracelinkApplication {

    public static void main(String[] args) {
        SpringApplication.run(TracelinkApplication.class, args);
    }
}
