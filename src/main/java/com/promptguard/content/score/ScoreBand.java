package com.promptguard.content.score;

/** Coarse reading of a composite score, used in logs and dashboards. */
public enum ScoreBand {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    NONE
}
