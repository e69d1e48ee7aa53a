package com.mergington.highschool;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HighSchoolApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(HighSchoolApiApplication.class, args);
    }
}
