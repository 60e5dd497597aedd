package com.example.legalrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LegalRagApplication {

    public static void main(String[] args) {
        SpringApplication.run(LegalRagApplication.class, args);
    }
}
