package com.legal.consult;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LegalConsultApplication {

    public static void main(String[] args) {
        SpringApplication.run(LegalConsultApplication.class, args);
    }
}
