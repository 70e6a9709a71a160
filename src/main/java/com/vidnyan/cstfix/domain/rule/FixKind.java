package com.vidnyan.cstfix.domain.rule;

/**
 * What kind of fix a rule can offer at all, declared in its metadata.
 */
public enum FixKind {
    NONE,
    SAFE,
    UNSAFE
}
