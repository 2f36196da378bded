package org.internmatch.engine.domain.capacity;

import org.internmatch.engine.domain.exception.CapacityExhaustedException;
import org.internmatch.engine.domain.exception.UnknownAllocationException;
import org.internmatch.engine.domain.exception.ValidationException;
import org.internmatch.engine.domain.model.AllocationOutcome;

import java.util.Map;

/**
 * Remaining open slots per internship. The only mutable state of the engine;
 * changed exclusively by {@link #allocate} and {@link #release}.
 */
public interface CapacityTracker {

    /**
     * Start tracking an internship. The first registration of an id wins; later calls for the
     * same id leave the live count untouched.
     *
     * @return true if the id was newly registered
     * @throws ValidationException if the id is blank or the capacity negative
     */
    boolean register(String internshipId, int initialCapacity);

    /**
     * Take one slot for an allocation. Retrying with an allocation id that is already committed
     * returns {@link AllocationOutcome#ALREADY_COMMITTED} and changes nothing.
     *
     * @throws CapacityExhaustedException if no slot remains; nothing is changed
     * @throws ValidationException        if the internship is not tracked or an id is blank
     */
    AllocationOutcome allocate(String internshipId, String allocationId);

    /**
     * Return the slot held by a committed allocation.
     *
     * @throws UnknownAllocationException if the allocation id is not committed on the internship
     * @throws ValidationException        if the internship is not tracked or an id is blank
     */
    AllocationOutcome release(String internshipId, String allocationId);

    /**
     * @throws ValidationException if the internship is not tracked
     */
    int remaining(String internshipId);

    boolean isRegistered(String internshipId);

    /**
     * Point-in-time copy of the remaining count of every tracked internship.
     */
    Map<String, Integer> snapshot();
}
