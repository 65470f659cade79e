package com.sovereign.core.engine;

/**
 * How one phase ended.
 */
public record PhaseReport(String phase, RunStatus status, long durationMs) {}
