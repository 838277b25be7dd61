package com.phillippitts.callcopilot.service.resilience;

/**
 * Outbound destination classes. Each has its own circuit breaker so a failing knowledge
 * base never blocks transcript forwarding.
 */
public enum Destination {
    FRONTEND("frontend"),
    LLM("llm"),
    KB("kb");

    private final String tag;

    Destination(String tag) {
        this.tag = tag;
    }

    /** Lower-case name used in logs, metric tags and exception context. */
    public String tag() {
        return tag;
    }
}
