package com.pallet.checkdigit.model;

/**
 * Outcome of classifying raw operator input.
 *
 * Only the three {@code COMPLETE_*} classes are resolvable: everything else must not
 * trigger a lookup, because lookups fire on every keystroke.
 */
public enum ValidationClass {

    EMPTY("Enter station number", false),
    TOO_SHORT("Keep typing...", false),
    PARTIAL_FORMAT("Keep typing...", false),
    COMPLETE_CANONICAL("Valid station format", true),
    COMPLETE_COMPACT("Compact format detected", true),
    COMPLETE_FULL("Full station format detected", true),
    PARTIAL_FULL("Add the trailing level digit", false),
    INVALID_CHARACTERS("Use only numbers and dashes", false),
    INVALID_FORMAT("Try format: 58-01 or 5801", false);

    private final String message;
    private final boolean resolvable;

    ValidationClass(String message, boolean resolvable) {
        this.message = message;
        this.resolvable = resolvable;
    }

    /** Operator-facing hint for this class. */
    public String getMessage() {
        return message;
    }

    /** Whether input of this class is complete enough to resolve against the store. */
    public boolean isResolvable() {
        return resolvable;
    }
}
