package com.delayer.timer.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Writes one INFO line per promoted topic group.
 */
@Component
@Slf4j
public class LoggingReadyJobListener implements ReadyJobListener {

    @Override
    public void onReady(String topic, List<String> jobIds) {
        log.info("Job is ready, Topic: {}, IDs: [{}]", topic, String.join(",", jobIds));
    }
}
