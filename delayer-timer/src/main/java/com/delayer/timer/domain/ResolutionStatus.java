package com.delayer.timer.domain;

/**
 * Outcome of a single topic lookup.
 */
public enum ResolutionStatus {
    RESOLVED,
    ORPHANED,
    FAILED
}
