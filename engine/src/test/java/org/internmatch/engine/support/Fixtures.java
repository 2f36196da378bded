package org.internmatch.engine.support;

import org.internmatch.engine.domain.model.Candidate;
import org.internmatch.engine.domain.model.EducationLevel;
import org.internmatch.engine.domain.model.Internship;
import org.internmatch.engine.domain.model.SocialCategory;

import java.util.Arrays;
import java.util.Collections;

/**
 * Test builders pre-filled with valid values.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static Candidate.Builder candidate() {
        return Candidate.builder()
                .id("c-1")
                .name("Asha Verma")
                .educationLevel(EducationLevel.BACHELOR)
                .skills(Arrays.asList("Python", "SQL"))
                .location("Pune")
                .sectorInterests(Collections.singletonList("Technology"))
                .socialCategory(SocialCategory.GENERAL);
    }

    public static Internship.Builder internship(String id) {
        return Internship.builder()
                .id(id)
                .title("Intern " + id)
                .company("Company " + id)
                .sector("Technology")
                .location("Pune")
                .skillsRequired(Arrays.asList("Python", "SQL"))
                .educationLevel(EducationLevel.BACHELOR)
                .capacity(3)
                .durationMonths(6)
                .stipend(10000);
    }
}
