package com.microtrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MicroTraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(MicroTraderApplication.class, args);
    }
}
