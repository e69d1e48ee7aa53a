package com.mergington.highschool.repository;

import java.util.List;

/**
 * Single-document roster updates and the distinct-days aggregation, which
 * derived queries cannot express.
 */
public interface ActivityRepositoryCustom {

    /**
     * Appends {@code email} to the participants of the named activity unless it
     * is already present.
     *
     * @return number of modified documents, 0 when nothing changed
     */
    long addParticipant(String activityName, String email);

    /**
     * Removes {@code email} from the participants of the named activity.
     *
     * @return number of modified documents, 0 when nothing changed
     */
    long removeParticipant(String activityName, String email);

    /**
     * @return every weekday that appears in some activity schedule, ascending
     */
    List<String> findDistinctScheduledDays();
}
