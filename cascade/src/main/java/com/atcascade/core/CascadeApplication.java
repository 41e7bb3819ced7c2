package com.atcascade.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CascadeApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CascadeApplication.class, args)));
    }
}
