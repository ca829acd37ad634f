package com.epcid;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EpcidApplication {

    public static void main(String[] args) {
        SpringApplication.run(EpcidApplication.class, args);
    }
}
