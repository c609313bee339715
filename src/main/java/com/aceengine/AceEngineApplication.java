package com.aceengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AceEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(AceEngineApplication.class, args);
    }
}
