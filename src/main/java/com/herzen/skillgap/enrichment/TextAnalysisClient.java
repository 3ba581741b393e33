package com.herzen.skillgap.enrichment;

import com.herzen.skillgap.domain.DomainModels.Course;

/**
 * Language-model course analysis.
 */
public interface TextAnalysisClient {

    /** False when the client is not configured; callers then skip the call. */
    boolean available();

    /**
     * @return the model's answer, expected to contain one JSON object
     */
    String analyzeCourse(Course course);
}
