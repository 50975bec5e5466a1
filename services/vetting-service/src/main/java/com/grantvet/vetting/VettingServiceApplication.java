package com.grantvet.vetting;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VettingServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(VettingServiceApplication.class, args);
    }
}
