package com.jreinhal.oplogstats;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OplogStatsApplication {

    public static void main(String[] args) {
        SpringApplication.run(OplogStatsApplication.class, args);
    }
}
