package com.promptguard.content.pattern;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ThreatCategory {

    INSTRUCTION_OVERRIDE("instruction_override"),
    JAILBREAK("jailbreak"),
    DATA_EXFILTRATION("data_exfiltration"),
    OUTPUT_MANIPULATION("output_manipulation"),
    PREDICTION_BIAS("prediction_bias"),
    RESOURCE_EXHAUSTION("resource_exhaustion");

    private final String id;

    ThreatCategory(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() { return id; }
}
