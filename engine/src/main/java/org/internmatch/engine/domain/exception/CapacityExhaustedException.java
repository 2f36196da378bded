package org.internmatch.engine.domain.exception;

/**
 * No remaining slots on the internship. Recoverable: the caller may try the next-ranked internship.
 */
public class CapacityExhaustedException extends AllocationException {

    public CapacityExhaustedException(String internshipId, String allocationId) {
        super(String.format("No remaining capacity on internship %s (allocation %s)", internshipId, allocationId),
                internshipId, allocationId);
    }
}
