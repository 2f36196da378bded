package org.internmatch.engine.domain.model;

/**
 * Successful result of a capacity confirmation call.
 */
public enum AllocationOutcome {
    /** A slot was taken for a new allocation id. */
    COMMITTED,
    /** The allocation id was already committed; nothing changed. */
    ALREADY_COMMITTED,
    /** A committed allocation was released and its slot returned. */
    RELEASED
}
