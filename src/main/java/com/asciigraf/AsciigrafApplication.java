package com.asciigraf;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AsciigrafApplication {

    public static void main(String[] args) {
        SpringApplication.run(AsciigrafApplication.class, args);
    }
}
