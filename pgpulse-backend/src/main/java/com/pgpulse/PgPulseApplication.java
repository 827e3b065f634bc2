package com.pgpulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PgPulseApplication {

    public static void main(String[] args) {
        SpringApplication.run(PgPulseApplication.class, args);
    }
}
