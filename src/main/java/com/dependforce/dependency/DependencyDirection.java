package com.dependforce.dependency;

/**
 * Which way discovery walks from the root object.
 */
public enum DependencyDirection {
    /** Objects that rely on the root object to exist */
    DEPENDENTS,
    /** Objects the root object relies on */
    DEPENDENCIES;

    /**
     * Parses a config value such as "dependents" or "Dependencies".
     */
    public static DependencyDirection fromString(String value) {
        if (value == null || value.trim().isEmpty()) {
            return DEPENDENTS;
        }
        for (DependencyDirection direction : values()) {
            if (direction.name().equalsIgnoreCase(value.trim())) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown dependency direction: " + value);
    }
}
