package com.swisspair;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SwissPairApplication {
    public static void main(String[] args) {
        SpringApplication.run(SwissPairApplication.class, args);
    }
}
