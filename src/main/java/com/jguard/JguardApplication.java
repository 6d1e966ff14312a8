package com.jguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class JguardApplication {

    public static void main(String[] args) {
        SpringApplication.run(JguardApplication.class, args);
    }
}
