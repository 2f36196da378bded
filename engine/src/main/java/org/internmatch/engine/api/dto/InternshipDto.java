package org.internmatch.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.internmatch.engine.domain.model.EducationLevel;
import org.internmatch.engine.domain.model.Internship;

import java.util.ArrayList;
import java.util.List;

/**
 * DTO for an internship record of the catalog API.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class InternshipDto {

    @JsonProperty("id")
    private String id;

    @JsonProperty("title")
    private String title;

    @JsonProperty("company")
    private String company;

    @JsonProperty("sector")
    private String sector;

    @JsonProperty("location")
    private String location;

    @JsonProperty("skills_required")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> skillsRequired;

    @JsonProperty("education_level")
    private String educationLevel;

    @JsonProperty("capacity")
    private Integer capacity;

    @JsonProperty("duration_months")
    private Integer durationMonths;

    @JsonProperty("stipend")
    private Integer stipend;

    @JsonProperty("rural_friendly")
    private Boolean ruralFriendly;

    @JsonProperty("diversity_focused")
    private Boolean diversityFocused;

    /**
     * Convert to the validated domain record.
     *
     * @throws org.internmatch.engine.domain.exception.ValidationException if a required field is
     *         missing or an enumeration value is unknown
     */
    public Internship toDomain() {
        return Internship.builder()
                .id(id)
                .title(title)
                .company(company)
                .sector(sector)
                .location(location)
                .skillsRequired(TermLists.split(skillsRequired))
                .educationLevel(EducationLevel.parse(educationLevel))
                .capacity(capacity != null ? capacity : 0)
                .durationMonths(durationMonths != null ? durationMonths : 0)
                .stipend(stipend != null ? stipend : 0)
                .ruralFriendly(Boolean.TRUE.equals(ruralFriendly))
                .diversityFocused(Boolean.TRUE.equals(diversityFocused))
                .build();
    }

    public static InternshipDto from(Internship internship) {
        InternshipDto dto = new InternshipDto();
        dto.id = internship.getId();
        dto.title = internship.getTitle();
        dto.company = internship.getCompany();
        dto.sector = internship.getSector();
        dto.location = internship.getLocation();
        dto.skillsRequired = new ArrayList<>(internship.getSkillsRequired());
        dto.educationLevel = internship.getEducationLevel().getLabel();
        dto.capacity = internship.getCapacity();
        dto.durationMonths = internship.getDurationMonths();
        dto.stipend = internship.getStipend();
        dto.ruralFriendly = internship.isRuralFriendly();
        dto.diversityFocused = internship.isDiversityFocused();
        return dto;
    }

    // Getters and Setters
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getCompany() {
        return company;
    }

    public void setCompany(String company) {
        this.company = company;
    }

    public String getSector() {
        return sector;
    }

    public void setSector(String sector) {
        this.sector = sector;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public List<String> getSkillsRequired() {
        return skillsRequired;
    }

    public void setSkillsRequired(List<String> skillsRequired) {
        this.skillsRequired = skillsRequired;
    }

    public String getEducationLevel() {
        return educationLevel;
    }

    public void setEducationLevel(String educationLevel) {
        this.educationLevel = educationLevel;
    }

    public Integer getCapacity() {
        return capacity;
    }

    public void setCapacity(Integer capacity) {
        this.capacity = capacity;
    }

    public Integer getDurationMonths() {
        return durationMonths;
    }

    public void setDurationMonths(Integer durationMonths) {
        this.durationMonths = durationMonths;
    }

    public Integer getStipend() {
        return stipend;
    }

    public void setStipend(Integer stipend) {
        this.stipend = stipend;
    }

    public Boolean getRuralFriendly() {
        return ruralFriendly;
    }

    public void setRuralFriendly(Boolean ruralFriendly) {
        this.ruralFriendly = ruralFriendly;
    }

    public Boolean getDiversityFocused() {
        return diversityFocused;
    }

    public void setDiversityFocused(Boolean diversityFocused) {
        this.diversityFocused = diversityFocused;
    }
}
