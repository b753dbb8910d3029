package com.umitunal.qworker.core;

/**
 * Queue priorities. Ready records are popped from higher priorities first.
 */
public enum Priority {
    HIGH,
    DEFAULT,
    LOW;

    /**
     * Parse a priority name, case-insensitive.
     *
     * @throws IllegalArgumentException if the name is not a known priority
     */
    public static Priority parse(String name) {
        for (Priority priority : values()) {
            if (priority.name().equalsIgnoreCase(name)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + name);
    }
}
