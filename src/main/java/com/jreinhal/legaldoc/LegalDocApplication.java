package com.jreinhal.legaldoc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LegalDocApplication {

    public static void main(String[] args) {
        SpringApplication.run(LegalDocApplication.class, args);
    }
}
