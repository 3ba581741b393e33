package com.herzen.skillgap.graph;

import java.util.List;

/**
 * External course graph. Implementations may throw on transport or server errors.
 */
public interface CourseGraphClient {

    boolean available();

    /**
     * @return ids of courses related to any of the given domain names, best first
     */
    List<String> coursesForDomains(List<String> domainNames, int limit);
}
