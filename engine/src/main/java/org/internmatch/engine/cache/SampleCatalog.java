package org.internmatch.engine.cache;

import org.internmatch.engine.domain.model.EducationLevel;
import org.internmatch.engine.domain.model.Internship;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Built-in internships used when no catalog API is configured or reachable.
 */
public final class SampleCatalog {

    private static final List<Internship> INTERNSHIPS = Collections.unmodifiableList(Arrays.asList(
            Internship.builder()
                    .id("1").title("Software Development Intern").company("TechCorp India")
                    .sector("Technology").location("Bangalore")
                    .skillsRequired(Arrays.asList("Python", "JavaScript", "React", "SQL"))
                    .educationLevel(EducationLevel.BACHELOR)
                    .capacity(5).durationMonths(6).stipend(15000)
                    .ruralFriendly(true).diversityFocused(true)
                    .build(),
            Internship.builder()
                    .id("2").title("Data Science Intern").company("DataAnalytics Ltd")
                    .sector("Technology").location("Mumbai")
                    .skillsRequired(Arrays.asList("Python", "Machine Learning", "Statistics", "Pandas"))
                    .educationLevel(EducationLevel.MASTER)
                    .capacity(3).durationMonths(4).stipend(20000)
                    .ruralFriendly(false).diversityFocused(true)
                    .build(),
            Internship.builder()
                    .id("3").title("Marketing Intern").company("BrandBuilders")
                    .sector("Marketing").location("Delhi")
                    .skillsRequired(Arrays.asList("Digital Marketing", "Social Media", "Content Writing", "Analytics"))
                    .educationLevel(EducationLevel.BACHELOR)
                    .capacity(4).durationMonths(3).stipend(12000)
                    .ruralFriendly(true).diversityFocused(false)
                    .build(),
            Internship.builder()
                    .id("4").title("Finance Intern").company("FinTech Solutions")
                    .sector("Finance").location("Chennai")
                    .skillsRequired(Arrays.asList("Excel", "Financial Analysis", "Accounting", "PowerBI"))
                    .educationLevel(EducationLevel.BACHELOR)
                    .capacity(2).durationMonths(5).stipend(18000)
                    .ruralFriendly(false).diversityFocused(true)
                    .build(),
            Internship.builder()
                    .id("5").title("Healthcare Research Intern").company("MedResearch Institute")
                    .sector("Healthcare").location("Hyderabad")
                    .skillsRequired(Arrays.asList("Research", "Data Analysis", "Medical Knowledge", "Python"))
                    .educationLevel(EducationLevel.MASTER)
                    .capacity(3).durationMonths(6).stipend(16000)
                    .ruralFriendly(true).diversityFocused(true)
                    .build()));

    private SampleCatalog() {
    }

    public static List<Internship> internships() {
        return INTERNSHIPS;
    }
}
