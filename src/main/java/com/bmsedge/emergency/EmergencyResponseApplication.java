package com.bmsedge.emergency;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EmergencyResponseApplication {

    public static void main(String[] args) {
        SpringApplication.run(EmergencyResponseApplication.class, args);
    }
}
