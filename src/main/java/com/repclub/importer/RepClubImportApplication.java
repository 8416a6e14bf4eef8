package com.repclub.importer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RepClubImportApplication {

    public static void main(String[] args) {
        SpringApplication.run(RepClubImportApplication.class, args);
    }
}
