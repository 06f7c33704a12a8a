package com.eainde.labreport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LabReportApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(LabReportApplication.class, args)));
    }
}
