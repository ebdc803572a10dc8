package com.overflowgrid;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OverflowGridApplication {

    public static void main(String[] args) {
        SpringApplication.run(OverflowGridApplication.class, args);
    }
}
