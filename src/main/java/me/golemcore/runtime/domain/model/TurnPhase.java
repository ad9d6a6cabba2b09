package me.golemcore.runtime.domain.model;

import java.util.Locale;

public enum TurnPhase {
    BEFORE, AFTER;

    public String scriptName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
