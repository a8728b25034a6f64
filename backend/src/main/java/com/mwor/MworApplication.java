package com.mwor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MworApplication {
    public static void main(String[] args) {
        SpringApplication.run(MworApplication.class, args);
    }
}
