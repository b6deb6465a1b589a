package com.adrelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AdRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdRelayApplication.class, args);
    }
}
