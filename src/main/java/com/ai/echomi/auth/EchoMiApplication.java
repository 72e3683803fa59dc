package com.ai.echomi.auth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.ai.echomi")
public class EchoMiApplication {

    public static void main(String[] args) {
        SpringApplication.run(EchoMiApplication.class, args);
    }
}
