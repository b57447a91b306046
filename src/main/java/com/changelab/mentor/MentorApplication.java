package com.changelab.mentor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MentorApplication {
    public static void main(String[] args) {
        SpringApplication.run(MentorApplication.class, args);
    }
}
