package com.jreinhal.assay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AssayApplication {

    public static void main(String[] args) {
        SpringApplication.run(AssayApplication.class, args);
    }
}
