package com.chicu.breachml;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.chicu.breachml")
public class BreachMlApplication {

    public static void main(String[] args) {
        SpringApplication.run(BreachMlApplication.class, args);
    }
}
