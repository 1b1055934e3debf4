package com.shelterops;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ShelterOpsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShelterOpsApplication.class, args);
    }
}
