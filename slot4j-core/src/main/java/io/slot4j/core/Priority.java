package io.slot4j.core;

public enum Priority {

    URGENT(100),
    HIGH(75),
    NORMAL(50),
    LOW(25),
    LOWEST(0);

    private final int value;

    Priority(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    /**
     * Clamp a raw priority into the supported 0..100 range.
     */
    public static int clamp(int priority) {
        return Math.max(LOWEST.value, Math.min(URGENT.value, priority));
    }
}
