package me.golemcore.runtime.domain.model;

public enum SubchatResolution {
    OPEN, COMPLETED, TIMED_OUT
}
