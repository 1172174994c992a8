package com.openrangelabs.donpetre.issuesync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IssueSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(IssueSyncApplication.class, args);
    }

}
