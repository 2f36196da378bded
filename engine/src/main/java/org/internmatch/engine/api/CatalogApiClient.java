package org.internmatch.engine.api;

import org.internmatch.engine.api.dto.CatalogResponseDto;
import org.internmatch.engine.api.dto.WeightSettingsDto;

/**
 * Client interface for the external data layer that owns internship records and settings.
 */
public interface CatalogApiClient {

    /**
     * Get all internships.
     * GET v1/internships
     *
     * @return the catalog, or null on failure
     */
    CatalogResponseDto getInternships();

    /**
     * Get the administrator's weight settings.
     * GET v1/settings/weights
     *
     * @return the settings, or null on failure or when none are stored
     */
    WeightSettingsDto getWeightSettings();
}
