package org.internmatch.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.internmatch.engine.domain.model.Recommendation;
import org.internmatch.engine.domain.model.ScoreBreakdown;

import java.util.ArrayList;
import java.util.List;

/**
 * Wire form of a ranked recommendation. Scores are rounded to three decimals.
 */
@JsonPropertyOrder({"rank", "internship", "scores", "match_reasons"})
public final class RecommendationDto {

    @JsonProperty("rank")
    private int rank;

    @JsonProperty("internship")
    private InternshipDto internship;

    @JsonProperty("scores")
    private ScoresDto scores;

    @JsonProperty("match_reasons")
    private List<String> matchReasons;

    public static RecommendationDto from(Recommendation recommendation) {
        RecommendationDto dto = new RecommendationDto();
        dto.rank = recommendation.getRank();
        dto.internship = InternshipDto.from(recommendation.getInternship());
        dto.scores = ScoresDto.from(recommendation.getOverallScore(), recommendation.getBreakdown());
        dto.matchReasons = new ArrayList<>(recommendation.getReasons());
        return dto;
    }

    static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    public int getRank() {
        return rank;
    }

    public InternshipDto getInternship() {
        return internship;
    }

    public ScoresDto getScores() {
        return scores;
    }

    public List<String> getMatchReasons() {
        return matchReasons;
    }

    @JsonPropertyOrder({"overall", "skill_match", "location_match", "education_match", "sector_match", "diversity_bonus"})
    public static final class ScoresDto {

        @JsonProperty("overall")
        private double overall;

        @JsonProperty("skill_match")
        private double skillMatch;

        @JsonProperty("location_match")
        private double locationMatch;

        @JsonProperty("education_match")
        private double educationMatch;

        @JsonProperty("sector_match")
        private double sectorMatch;

        @JsonProperty("diversity_bonus")
        private double diversityBonus;

        static ScoresDto from(double overall, ScoreBreakdown breakdown) {
            ScoresDto dto = new ScoresDto();
            dto.overall = round3(overall);
            dto.skillMatch = round3(breakdown.getSkill());
            dto.locationMatch = round3(breakdown.getLocation());
            dto.educationMatch = round3(breakdown.getEducation());
            dto.sectorMatch = round3(breakdown.getSector());
            dto.diversityBonus = round3(breakdown.getDiversity());
            return dto;
        }

        public double getOverall() {
            return overall;
        }

        public double getSkillMatch() {
            return skillMatch;
        }

        public double getLocationMatch() {
            return locationMatch;
        }

        public double getEducationMatch() {
            return educationMatch;
        }

        public double getSectorMatch() {
            return sectorMatch;
        }

        public double getDiversityBonus() {
            return diversityBonus;
        }
    }
}
