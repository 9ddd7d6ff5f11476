package com.example.hotbox;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HotboxApplication {

    public static void main(String[] args) {
        SpringApplication.run(HotboxApplication.class, args);
    }
}
