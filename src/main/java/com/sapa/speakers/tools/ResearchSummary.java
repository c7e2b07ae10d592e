package com.sapa.speakers.tools;

import java.util.List;

/**
 * Findings about a prospective speaker, collected before they are added to the database.
 */
public record ResearchSummary(String name, String affiliation, String position, String fieldSpecialty,
                              String background, String notableWork, List<String> potentialTopics,
                              String linkedinUrl, String email, String priorityRecommendation) {

    public ResearchSummary {
        potentialTopics = potentialTopics == null ? List.of() : List.copyOf(potentialTopics);
    }
}
