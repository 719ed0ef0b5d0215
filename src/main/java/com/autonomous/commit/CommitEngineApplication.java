package com.autonomous.commit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CommitEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CommitEngineApplication.class, args);
    }
}
