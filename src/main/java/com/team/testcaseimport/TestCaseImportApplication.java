package com.team.testcaseimport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TestCaseImportApplication {

    public static void main(String[] args) {
        SpringApplication.run(TestCaseImportApplication.class, args);
    }
}
