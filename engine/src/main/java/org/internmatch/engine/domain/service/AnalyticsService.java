package org.internmatch.engine.domain.service;

import org.internmatch.engine.domain.model.AnalyticsSummary;
import org.internmatch.engine.domain.model.Candidate;
import org.internmatch.engine.domain.model.Internship;

import java.util.Collection;

/**
 * Aggregate reporting over candidates, internships and capacity.
 */
public interface AnalyticsService {

    AnalyticsSummary summarize(Collection<Candidate> candidates, Collection<Internship> internships);
}
