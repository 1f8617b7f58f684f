package com.minerpayout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MinerPayoutApplication {

    public static void main(String[] args) {
        SpringApplication.run(MinerPayoutApplication.class, args);
    }
}
