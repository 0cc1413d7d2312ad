package com.redzone.overweight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OverweightMetricsApplication {

    public static void main(String[] args) {
        SpringApplication.run(OverweightMetricsApplication.class, args);
    }
}
