package com.sovereign.core.planner;

public enum SubtaskStatus {
    COMPLETE,
    REJECTED
}
