package com.deepansh.kitchen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class KitchenAssistantApplication {
    public static void main(String[] args) {
        SpringApplication.run(KitchenAssistantApplication.class, args);
    }
}
