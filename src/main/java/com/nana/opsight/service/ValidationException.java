package com.nana.opsight.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ValidationException - an input file that cannot be loaded as it stands.
 *
 * <p>Carries one entry per offending field (column name to message) so that
 * a single failure reports everything wrong with the chunk at once: every
 * missing required column, or every distinct unrecognised shift label.
 *
 * <p>Checked: the caller must decide what to tell the person who supplied
 * the file. The load is aborted and the current chunk rolled back; chunks
 * committed earlier stay committed.
 */
public class ValidationException extends Exception {

    private final Map<String, String> fieldErrors;

    // -----------------------------------------------------------------------
    // CONSTRUCTORS
    // -----------------------------------------------------------------------

    /**
     * @param fieldErrors field name to error message, in reporting order
     */
    public ValidationException(Map<String, String> fieldErrors) {
        super(buildMessage(fieldErrors));
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    public ValidationException(String fieldName, String errorMessage) {
        super(fieldName + ": " + errorMessage);
        Map<String, String> map = new LinkedHashMap<>();
        map.put(fieldName, errorMessage);
        this.fieldErrors = Collections.unmodifiableMap(map);
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    /** @return an unmodifiable map of field name to error message */
    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }

    public boolean hasError(String fieldName) {
        return fieldErrors.containsKey(fieldName);
    }

    /** @return the message for {@code fieldName}, or null if it has none */
    public String getError(String fieldName) {
        return fieldErrors.get(fieldName);
    }

    private static String buildMessage(Map<String, String> errors) {
        if (errors == null || errors.isEmpty()) {
            return "Validation failed with no specific field errors.";
        }
        StringBuilder sb = new StringBuilder("Validation failed: ");
        errors.forEach((field, msg) -> sb.append(field).append(": ").append(msg).append("; "));
        sb.setLength(sb.length() - 2);
        return sb.toString();
    }
}
