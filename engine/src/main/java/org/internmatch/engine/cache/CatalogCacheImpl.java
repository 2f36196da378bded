package org.internmatch.engine.cache;

import org.internmatch.engine.api.CatalogApiClient;
import org.internmatch.engine.api.dto.CatalogResponseDto;
import org.internmatch.engine.api.dto.InternshipDto;
import org.internmatch.engine.api.dto.WeightSettingsDto;
import org.internmatch.engine.domain.capacity.CapacityTracker;
import org.internmatch.engine.domain.exception.ValidationException;
import org.internmatch.engine.domain.model.Internship;
import org.internmatch.engine.domain.model.WeightConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe implementation of CatalogCache.
 * Uses read-write lock for concurrent access with exclusive writes. Without a catalog API, or
 * when the first load from it fails, the built-in sample catalog and default weights are served.
 */
public final class CatalogCacheImpl implements CatalogCache {

    private static final Logger LOG = Logger.getLogger(CatalogCacheImpl.class.getName());

    private final CatalogApiClient apiClient;
    private final CapacityTracker capacityTracker;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private volatile boolean initialized = false;
    private WeightConfig weights = WeightConfig.defaults();
    private Map<String, Internship> internships = Collections.emptyMap();

    /**
     * Offline cache serving the sample catalog.
     */
    public CatalogCacheImpl(CapacityTracker capacityTracker) {
        this.apiClient = null;
        this.capacityTracker = Objects.requireNonNull(capacityTracker, "capacityTracker must not be null");
    }

    public CatalogCacheImpl(CatalogApiClient apiClient, CapacityTracker capacityTracker) {
        this.apiClient = Objects.requireNonNull(apiClient, "apiClient must not be null");
        this.capacityTracker = Objects.requireNonNull(capacityTracker, "capacityTracker must not be null");
    }

    @Override
    public void refresh() {
        if (apiClient == null) {
            installSampleIfEmpty();
            return;
        }

        LOG.info("Refreshing internship catalog from API...");

        try {
            CatalogResponseDto catalog = apiClient.getInternships();
            if (catalog == null || catalog.getInternships() == null) {
                LOG.warning("API returned no catalog, keeping existing internships");
                installSampleIfEmpty();
            } else {
                List<Internship> loaded = toDomain(catalog.getInternships());
                lock.writeLock().lock();
                try {
                    install(loaded);
                    this.initialized = true;
                } finally {
                    lock.writeLock().unlock();
                }
                LOG.info(() -> "Loaded " + loaded.size() + " internships");
            }

            WeightSettingsDto settings = apiClient.getWeightSettings();
            if (settings != null) {
                WeightConfig loadedWeights = settings.toWeightConfig();
                lock.writeLock().lock();
                try {
                    this.weights = loadedWeights;
                } finally {
                    lock.writeLock().unlock();
                }
                LOG.info(() -> "Loaded weight settings: " + loadedWeights);
            }

        } catch (ValidationException e) {
            LOG.log(Level.WARNING, "Rejected weight settings from API, keeping current weights", e);
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Failed to refresh internship catalog", e);
            // Keep existing data on failure
            installSampleIfEmpty();
        }
    }

    private void installSampleIfEmpty() {
        lock.writeLock().lock();
        try {
            if (internships.isEmpty()) {
                install(SampleCatalog.internships());
                LOG.info(() -> "Serving sample catalog with " + internships.size() + " internships");
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Map DTOs to domain records, skipping malformed rows and repeated ids.
     */
    private List<Internship> toDomain(List<InternshipDto> dtos) {
        Map<String, Internship> byId = new LinkedHashMap<>();
        for (InternshipDto dto : dtos) {
            try {
                Internship internship = dto.toDomain();
                if (byId.putIfAbsent(internship.getId(), internship) != null) {
                    LOG.warning(() -> "Skipping duplicate internship id: " + internship.getId());
                }
            } catch (ValidationException e) {
                LOG.warning(() -> "Skipping malformed internship record: " + e.getMessage());
            }
        }
        return new ArrayList<>(byId.values());
    }

    /**
     * Replace the snapshot and start tracking capacity of internships seen for the first time.
     * Caller holds the write lock.
     */
    private void install(List<Internship> loaded) {
        Map<String, Internship> byId = new LinkedHashMap<>();
        for (Internship internship : loaded) {
            byId.put(internship.getId(), internship);
            capacityTracker.register(internship.getId(), internship.getCapacity());
        }
        this.internships = Collections.unmodifiableMap(byId);
    }

    @Override
    public List<Internship> getInternships() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(internships.values()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Internship> findInternship(String internshipId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(internships.get(internshipId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public WeightConfig getWeights() {
        lock.readLock().lock();
        try {
            return weights;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }
}
