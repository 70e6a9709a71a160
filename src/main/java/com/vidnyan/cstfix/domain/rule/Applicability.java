package com.vidnyan.cstfix.domain.rule;

/**
 * Confidence that an action preserves the program's meaning.
 */
public enum Applicability {
    /** Safe to apply without review. */
    ALWAYS,
    /** Probably right, but a human should look at it. */
    MAYBE_INCORRECT
}
