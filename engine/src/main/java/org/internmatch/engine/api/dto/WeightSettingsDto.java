package org.internmatch.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.internmatch.engine.domain.model.ScoreFactor;
import org.internmatch.engine.domain.model.WeightConfig;

import java.util.HashMap;
import java.util.Map;

/**
 * Response DTO for GET v1/settings/weights. Weights may be on any scale, typically percentages.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class WeightSettingsDto {

    @JsonProperty("skill")
    private Double skill;

    @JsonProperty("location")
    private Double location;

    @JsonProperty("education")
    private Double education;

    @JsonProperty("sector")
    private Double sector;

    @JsonProperty("diversity")
    private Double diversity;

    /**
     * Rescale to a weight vector summing to 1.0. Missing weights count as zero.
     *
     * @throws org.internmatch.engine.domain.exception.ValidationException if a weight is negative
     *         or all are zero
     */
    public WeightConfig toWeightConfig() {
        Map<String, Double> raw = new HashMap<>();
        raw.put(ScoreFactor.SKILL.getWeightKey(), skill);
        raw.put(ScoreFactor.LOCATION.getWeightKey(), location);
        raw.put(ScoreFactor.EDUCATION.getWeightKey(), education);
        raw.put(ScoreFactor.SECTOR.getWeightKey(), sector);
        raw.put(ScoreFactor.DIVERSITY.getWeightKey(), diversity);
        return WeightConfig.normalized(raw);
    }

    public Double getSkill() {
        return skill;
    }

    public void setSkill(Double skill) {
        this.skill = skill;
    }

    public Double getLocation() {
        return location;
    }

    public void setLocation(Double location) {
        this.location = location;
    }

    public Double getEducation() {
        return education;
    }

    public void setEducation(Double education) {
        this.education = education;
    }

    public Double getSector() {
        return sector;
    }

    public void setSector(Double sector) {
        this.sector = sector;
    }

    public Double getDiversity() {
        return diversity;
    }

    public void setDiversity(Double diversity) {
        this.diversity = diversity;
    }
}
