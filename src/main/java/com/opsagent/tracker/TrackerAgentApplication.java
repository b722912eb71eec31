package com.opsagent.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrackerAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrackerAgentApplication.class, args);
    }
}
