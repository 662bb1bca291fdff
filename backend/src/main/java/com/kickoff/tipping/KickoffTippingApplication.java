package com.kickoff.tipping;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KickoffTippingApplication {
    public static void main(String[] args) {
        SpringApplication.run(KickoffTippingApplication.class, args);
    }
}
