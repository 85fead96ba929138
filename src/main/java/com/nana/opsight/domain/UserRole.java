package com.nana.opsight.domain;

/**
 * Roles a monitoring-tool {@link User} can hold.
 */
public enum UserRole {

    ADMIN("Administrator"),
    ANALYST("Security Analyst"),
    OPERATOR("Plant Operator"),
    VIEWER("Read-only Viewer");

    private final String displayName;

    UserRole(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Case-insensitive lookup used when mapping stored rows.
     *
     * @param value the stored role text
     * @return the matching role, or {@link #VIEWER} when null, blank or unknown
     */
    public static UserRole fromString(String value) {
        if (value == null || value.isBlank()) {
            return VIEWER;
        }
        for (UserRole r : values()) {
            if (r.name().equalsIgnoreCase(value.trim())) {
                return r;
            }
        }
        // Least privilege for anything unrecognised.
        return VIEWER;
    }

    @Override
    public String toString() {
        return name();
    }
}
