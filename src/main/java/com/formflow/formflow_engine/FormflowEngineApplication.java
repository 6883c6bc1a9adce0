package com.formflow.formflow_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FormflowEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(FormflowEngineApplication.class, args);
    }
}
