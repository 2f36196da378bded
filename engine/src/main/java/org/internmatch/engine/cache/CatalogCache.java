package org.internmatch.engine.cache;

import org.internmatch.engine.domain.model.Internship;
import org.internmatch.engine.domain.model.WeightConfig;

import java.util.List;
import java.util.Optional;

/**
 * Snapshot of the internship catalog and the current weight settings.
 */
public interface CatalogCache {

    /**
     * Load or refresh the catalog and weight settings.
     */
    void refresh();

    /**
     * All internships of the current snapshot, in catalog order.
     */
    List<Internship> getInternships();

    Optional<Internship> findInternship(String internshipId);

    /**
     * Weight configuration to use when a request does not supply its own.
     */
    WeightConfig getWeights();

    /**
     * True once internships from the catalog API have been loaded.
     */
    boolean isInitialized();
}
