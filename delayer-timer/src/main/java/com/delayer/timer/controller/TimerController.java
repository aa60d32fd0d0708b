package com.delayer.timer.controller;

import com.delayer.timer.controller.dto.TimerStatusResponse;
import com.delayer.timer.domain.PassReport;
import com.delayer.timer.infrastructure.TimerScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for operating the delayer timer.
 */
@RestController
@RequestMapping("/timer")
@RequiredArgsConstructor
@Slf4j
public class TimerController {

    private final TimerScheduler timerScheduler;

    /**
     * Get the timer status and the report of the latest pass.
     */
    @GetMapping
    public ResponseEntity<TimerStatusResponse> getStatus() {
        return ResponseEntity.ok(status(timerScheduler.isRunning() ? "Timer is running" : "Timer is stopped"));
    }

    @PostMapping("/start")
    public ResponseEntity<TimerStatusResponse> start() {
        log.info("POST /timer/start");

        boolean started = timerScheduler.start();

        return ResponseEntity.ok(status(started ? "Timer started" : "Timer already running"));
    }

    @PostMapping("/stop")
    public ResponseEntity<TimerStatusResponse> stop() {
        log.info("POST /timer/stop");

        boolean stopped = timerScheduler.stop();

        return ResponseEntity.ok(status(stopped ? "Timer stopped" : "Timer was not running"));
    }

    /**
     * Run one pass now, independently of the timer.
     *
     * @return the report of that pass
     */
    @PostMapping("/passes")
    public ResponseEntity<PassReport> runPass() {
        log.info("POST /timer/passes - Running promotion pass on demand");

        PassReport report = timerScheduler.runOnce();

        return ResponseEntity.ok(report);
    }

    private TimerStatusResponse status(String message) {
        return TimerStatusResponse.builder()
                .running(timerScheduler.isRunning())
                .intervalMs(timerScheduler.getIntervalMs())
                .ticks(timerScheduler.getTicks())
                .droppedTicks(timerScheduler.getDroppedTicks())
                .passesCompleted(timerScheduler.getPassesCompleted())
                .message(message)
                .lastPass(timerScheduler.getLastReport())
                .build();
    }
}
