package com.mrpsimulator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MrpSimulatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(MrpSimulatorApplication.class, args);
    }
}
