package com.delayer.timer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the delayer timer.
 * Moves expired jobs from the job pool into their topics' ready queues.
 */
@SpringBootApplication
public class DelayerTimerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DelayerTimerApplication.class, args);
    }

}
