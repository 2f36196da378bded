package org.internmatch.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for GET v1/internships.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CatalogResponseDto {

    @JsonProperty("success")
    private boolean success;

    @JsonProperty("internships")
    private List<InternshipDto> internships;

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public List<InternshipDto> getInternships() {
        return internships;
    }

    public void setInternships(List<InternshipDto> internships) {
        this.internships = internships;
    }
}
