package com.synclab.laddersim;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LadderSimApplication {

    public static void main(String[] args) {
        SpringApplication.run(LadderSimApplication.class, args);
    }
}
