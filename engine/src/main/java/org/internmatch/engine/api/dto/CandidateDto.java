package org.internmatch.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.internmatch.engine.domain.model.Candidate;
import org.internmatch.engine.domain.model.EducationLevel;
import org.internmatch.engine.domain.model.SocialCategory;

import java.util.List;
import java.util.UUID;

/**
 * DTO for a candidate profile as submitted by the registration form.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CandidateDto {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("education_level")
    private String educationLevel;

    @JsonProperty("skills")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> skills;

    @JsonProperty("location")
    private String location;

    @JsonProperty("sector_interests")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> sectorInterests;

    @JsonProperty("social_category")
    private String socialCategory;

    @JsonProperty("from_rural_area")
    private Boolean fromRuralArea;

    @JsonProperty("prefers_rural")
    private Boolean prefersRural;

    @JsonProperty("first_generation_graduate")
    private Boolean firstGenerationGraduate;

    /**
     * Convert to the validated domain record. A profile submitted without an id gets a random one.
     *
     * @throws org.internmatch.engine.domain.exception.ValidationException if a required field is
     *         missing or an enumeration value is unknown
     */
    public Candidate toDomain() {
        String candidateId = id == null || id.trim().isEmpty() ? UUID.randomUUID().toString() : id;
        return Candidate.builder()
                .id(candidateId)
                .name(name)
                .educationLevel(EducationLevel.parse(educationLevel))
                .skills(TermLists.split(skills))
                .location(location)
                .sectorInterests(TermLists.split(sectorInterests))
                .socialCategory(SocialCategory.parse(socialCategory))
                .fromRuralArea(Boolean.TRUE.equals(fromRuralArea))
                .prefersRural(Boolean.TRUE.equals(prefersRural))
                .firstGenerationGraduate(Boolean.TRUE.equals(firstGenerationGraduate))
                .build();
    }

    // Getters and Setters
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getEducationLevel() {
        return educationLevel;
    }

    public void setEducationLevel(String educationLevel) {
        this.educationLevel = educationLevel;
    }

    public List<String> getSkills() {
        return skills;
    }

    public void setSkills(List<String> skills) {
        this.skills = skills;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public List<String> getSectorInterests() {
        return sectorInterests;
    }

    public void setSectorInterests(List<String> sectorInterests) {
        this.sectorInterests = sectorInterests;
    }

    public String getSocialCategory() {
        return socialCategory;
    }

    public void setSocialCategory(String socialCategory) {
        this.socialCategory = socialCategory;
    }

    public Boolean getFromRuralArea() {
        return fromRuralArea;
    }

    public void setFromRuralArea(Boolean fromRuralArea) {
        this.fromRuralArea = fromRuralArea;
    }

    public Boolean getPrefersRural() {
        return prefersRural;
    }

    public void setPrefersRural(Boolean prefersRural) {
        this.prefersRural = prefersRural;
    }

    public Boolean getFirstGenerationGraduate() {
        return firstGenerationGraduate;
    }

    public void setFirstGenerationGraduate(Boolean firstGenerationGraduate) {
        this.firstGenerationGraduate = firstGenerationGraduate;
    }
}
