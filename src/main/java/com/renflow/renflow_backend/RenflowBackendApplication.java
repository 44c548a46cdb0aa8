package com.renflow.renflow_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RenflowBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(RenflowBackendApplication.class, args);
    }
}
