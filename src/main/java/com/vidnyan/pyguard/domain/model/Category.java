package com.vidnyan.pyguard.domain.model;

/**
 * Rule families.
 */
public enum Category {
    RUNTIME("Runtime"),
    PERFORMANCE("Performance"),
    COMPLEXITY("Complexity"),
    SECURITY("Security"),
    ORGANIZATION("Organization"),
    RESOURCE("Resource"),
    GOTCHA("Gotcha");

    private final String label;

    Category(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
