package com.delayer.timer.service;

import java.util.List;

/**
 * Notified once per topic group after its jobs were committed to the ready queue.
 */
@FunctionalInterface
public interface ReadyJobListener {

    void onReady(String topic, List<String> jobIds);
}
