package com.example.fourchess;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FourChessApplication {

    public static void main(String[] args) {
        SpringApplication.run(FourChessApplication.class, args);
    }
}
