package com.kingsfoil.kingsfoil;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class KingsfoilApplication {

    public static void main(String[] args) {
        SpringApplication.run(KingsfoilApplication.class, args);
    }
}
