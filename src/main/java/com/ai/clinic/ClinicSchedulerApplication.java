package com.ai.clinic;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClinicSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClinicSchedulerApplication.class, args);
    }
}
