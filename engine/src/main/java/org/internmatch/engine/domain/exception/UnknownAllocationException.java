package org.internmatch.engine.domain.exception;

/**
 * Release requested for an allocation that was never committed on the internship.
 */
public class UnknownAllocationException extends AllocationException {

    public UnknownAllocationException(String internshipId, String allocationId) {
        super(String.format("Allocation %s is not committed on internship %s", allocationId, internshipId),
                internshipId, allocationId);
    }
}
