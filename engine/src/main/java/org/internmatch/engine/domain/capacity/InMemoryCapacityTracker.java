package org.internmatch.engine.domain.capacity;

import org.internmatch.engine.domain.exception.CapacityExhaustedException;
import org.internmatch.engine.domain.exception.UnknownAllocationException;
import org.internmatch.engine.domain.exception.ValidationException;
import org.internmatch.engine.domain.model.AllocationOutcome;
import org.internmatch.engine.domain.model.Internship;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;

/**
 * Thread-safe CapacityTracker. Each internship id has its own slot guarded by its own monitor,
 * so operations on different internships never contend.
 */
public final class InMemoryCapacityTracker implements CapacityTracker {

    private static final Logger LOG = Logger.getLogger(InMemoryCapacityTracker.class.getName());

    private final ConcurrentMap<String, Slot> slots = new ConcurrentHashMap<>();

    public InMemoryCapacityTracker() {
    }

    /**
     * Creates a tracker initialized from the internships' capacities.
     */
    public InMemoryCapacityTracker(Collection<Internship> internships) {
        for (Internship internship : internships) {
            register(internship.getId(), internship.getCapacity());
        }
    }

    @Override
    public boolean register(String internshipId, int initialCapacity) {
        requireId(internshipId, "internshipId");
        if (initialCapacity < 0) {
            throw new ValidationException("Capacity must not be negative for internship " + internshipId);
        }
        boolean added = slots.putIfAbsent(internshipId, new Slot(initialCapacity)) == null;
        if (added) {
            LOG.fine(() -> String.format("Tracking internship %s with capacity %d", internshipId, initialCapacity));
        }
        return added;
    }

    @Override
    public AllocationOutcome allocate(String internshipId, String allocationId) {
        requireId(allocationId, "allocationId");
        Slot slot = slotFor(internshipId);
        AllocationOutcome outcome;
        synchronized (slot) {
            if (slot.committed.contains(allocationId)) {
                outcome = AllocationOutcome.ALREADY_COMMITTED;
            } else if (slot.remaining == 0) {
                LOG.warning(() -> String.format("Capacity exhausted on internship %s, allocation %s rejected",
                        internshipId, allocationId));
                throw new CapacityExhaustedException(internshipId, allocationId);
            } else {
                slot.remaining--;
                slot.committed.add(allocationId);
                outcome = AllocationOutcome.COMMITTED;
            }
        }
        if (outcome == AllocationOutcome.COMMITTED) {
            LOG.info(() -> String.format("Allocation %s committed on internship %s", allocationId, internshipId));
        } else {
            LOG.fine(() -> String.format("Allocation %s already committed on internship %s", allocationId, internshipId));
        }
        return outcome;
    }

    @Override
    public AllocationOutcome release(String internshipId, String allocationId) {
        requireId(allocationId, "allocationId");
        Slot slot = slotFor(internshipId);
        synchronized (slot) {
            if (!slot.committed.remove(allocationId)) {
                throw new UnknownAllocationException(internshipId, allocationId);
            }
            slot.remaining++;
        }
        LOG.info(() -> String.format("Allocation %s released on internship %s", allocationId, internshipId));
        return AllocationOutcome.RELEASED;
    }

    @Override
    public int remaining(String internshipId) {
        Slot slot = slotFor(internshipId);
        synchronized (slot) {
            return slot.remaining;
        }
    }

    @Override
    public boolean isRegistered(String internshipId) {
        return internshipId != null && slots.containsKey(internshipId);
    }

    @Override
    public Map<String, Integer> snapshot() {
        Map<String, Integer> copy = new TreeMap<>();
        slots.forEach((id, slot) -> {
            synchronized (slot) {
                copy.put(id, slot.remaining);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    private Slot slotFor(String internshipId) {
        requireId(internshipId, "internshipId");
        Slot slot = slots.get(internshipId);
        if (slot == null) {
            throw new ValidationException("Unknown internship: " + internshipId);
        }
        return slot;
    }

    private static void requireId(String value, String field) {
        if (value == null || value.trim().isEmpty()) {
            throw new ValidationException(field + " is required");
        }
    }

    private static final class Slot {
        private int remaining;
        private final Set<String> committed = new HashSet<>();

        private Slot(int remaining) {
            this.remaining = remaining;
        }
    }
}
