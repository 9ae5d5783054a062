package com.botstate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BotStateApplication {

    public static void main(String[] args) {
        SpringApplication.run(BotStateApplication.class, args);
    }
}
