package com.delayer.timer.controller.dto;

import com.delayer.timer.domain.PassReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO describing the timer's state.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TimerStatusResponse {

    private boolean running;
    private long intervalMs;
    private long ticks;
    private long droppedTicks;
    private long passesCompleted;
    private String message;

    // Null until the first pass has finished
    private PassReport lastPass;
}
