package com.tomeqa.index;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TomeIndexServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(TomeIndexServiceApplication.class, args);
    }
}
