package org.internmatch.engine.domain.exception;

/**
 * Base type for failures of capacity confirmation calls.
 */
public abstract class AllocationException extends RuntimeException {

    private final String internshipId;
    private final String allocationId;

    protected AllocationException(String message, String internshipId, String allocationId) {
        super(message);
        this.internshipId = internshipId;
        this.allocationId = allocationId;
    }

    public String getInternshipId() {
        return internshipId;
    }

    public String getAllocationId() {
        return allocationId;
    }
}
