package com.mod98.alpaca.earningsbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EarningsBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(EarningsBotApplication.class, args);
    }
}
