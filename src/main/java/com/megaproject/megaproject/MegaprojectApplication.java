package com.megaproject.megaproject;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MegaprojectApplication {

    public static void main(String[] args) {
        SpringApplication.run(MegaprojectApplication.class, args);
    }
}
