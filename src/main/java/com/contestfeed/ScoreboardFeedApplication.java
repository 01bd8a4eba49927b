package com.contestfeed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main Spring Boot application for the scoreboard event feed.
 */
@SpringBootApplication
@EnableScheduling
public class ScoreboardFeedApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScoreboardFeedApplication.class, args);
    }
}
